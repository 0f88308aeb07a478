package dev.twiliovoice.sdk;

/**
 * Exception representing an error returned by the Twilio REST API. When the API responds with a non-2xx status the SDK
 * hydrates this type so callers can inspect both the HTTP status and the structured Twilio error code.
 */
public final class TwilioApiException extends TwilioException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final Integer code;
    private final String moreInfo;

    public TwilioApiException(int statusCode, Integer code, String message, String moreInfo) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
        this.moreInfo = moreInfo;
    }

    /**
     * @return HTTP status code returned by the API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return Twilio error code, for example {@code 20003} for authentication failures (nullable when the response body
     * did not include one).
     */
    public Integer getCode() {
        return code;
    }

    /**
     * @return link to the Twilio error documentation (nullable).
     */
    public String getMoreInfo() {
        return moreInfo;
    }

    private static String defaultMessage(int status, Integer code) {
        if (code == null) {
            return "Twilio request failed with status " + status;
        }
        return "Twilio request failed with status " + status + " (" + code + ")";
    }
}
