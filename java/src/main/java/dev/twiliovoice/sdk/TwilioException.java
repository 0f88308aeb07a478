package dev.twiliovoice.sdk;

/**
 * Base exception thrown by the Twilio voice SDK.
 */
public class TwilioException extends Exception {

    private static final long serialVersionUID = 1L;

    public TwilioException(String message) {
        super(message);
    }

    public TwilioException(String message, Throwable cause) {
        super(message, cause);
    }
}
