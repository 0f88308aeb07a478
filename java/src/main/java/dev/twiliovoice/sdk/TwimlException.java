package dev.twiliovoice.sdk;

/**
 * Raised when a TwiML document cannot be produced, either because a noun carries an invalid attribute or because the
 * XML writer failed.
 */
public final class TwimlException extends TwilioException {

    private static final long serialVersionUID = 1L;

    public TwimlException(String message) {
        super(message);
    }

    public TwimlException(String message, Throwable cause) {
        super(message, cause);
    }
}
