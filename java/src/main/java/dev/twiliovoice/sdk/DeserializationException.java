package dev.twiliovoice.sdk;

/**
 * Raised when a payload does not match the expected shape: an API success body, a webhook request or a media stream
 * frame.
 */
public final class DeserializationException extends TwilioException {

    private static final long serialVersionUID = 1L;

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
