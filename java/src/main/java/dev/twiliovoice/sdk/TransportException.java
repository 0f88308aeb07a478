package dev.twiliovoice.sdk;

/**
 * Raised when a request could not be completed because no HTTP response was obtained (connection refused, timeout,
 * thread interruption, ...). Requests are never retried by the SDK.
 */
public final class TransportException extends TwilioException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
