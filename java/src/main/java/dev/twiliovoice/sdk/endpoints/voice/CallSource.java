package dev.twiliovoice.sdk.endpoints.voice;

import java.util.Objects;

/**
 * Where Twilio gets the instructions for an outbound call: a TwiML URL, inline TwiML, or a TwiML application.
 * Exactly one of them is sent with a create call request.
 */
public final class CallSource {

    public enum Kind {
        URL("Url"),
        TWIML("Twiml"),
        APPLICATION_SID("ApplicationSid");

        private final String param;

        Kind(String param) {
            this.param = param;
        }

        public String param() {
            return param;
        }
    }

    private final Kind kind;
    private final String value;

    private CallSource(Kind kind, String value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, kind.param());
    }

    public static CallSource url(String url) {
        return new CallSource(Kind.URL, url);
    }

    public static CallSource twiml(String twiml) {
        return new CallSource(Kind.TWIML, twiml);
    }

    public static CallSource applicationSid(String applicationSid) {
        return new CallSource(Kind.APPLICATION_SID, applicationSid);
    }

    public Kind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallSource)) {
            return false;
        }
        CallSource other = (CallSource) o;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind.param() + '=' + value;
    }
}
