package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.FormWriter;
import dev.twiliovoice.sdk.endpoints.RequestBody;
import dev.twiliovoice.sdk.endpoints.WireValue;

import java.util.List;
import java.util.Optional;

/**
 * Payload of an update call request: redirect a live call to new instructions, or end it. Every field is optional.
 */
public final class UpdateCallBody implements RequestBody {

    /**
     * Terminal states a live call can be moved to.
     */
    public enum TargetStatus implements WireValue {
        /** Ends a call that has not been answered yet. */
        CANCELED("canceled"),
        /** Hangs up a call in progress. */
        COMPLETED("completed");

        private final String wireValue;

        TargetStatus(String wireValue) {
            this.wireValue = wireValue;
        }

        @Override
        public String wireValue() {
            return wireValue;
        }
    }

    private final String url;
    private final String twiml;
    private final CallbackMethod method;
    private final TargetStatus status;
    private final String fallbackUrl;
    private final CallbackMethod fallbackMethod;
    private final String statusCallback;
    private final CallbackMethod statusCallbackMethod;
    private final Integer timeLimit;

    private UpdateCallBody(Builder builder) {
        this.url = builder.url;
        this.twiml = builder.twiml;
        this.method = builder.method;
        this.status = builder.status;
        this.fallbackUrl = builder.fallbackUrl;
        this.fallbackMethod = builder.fallbackMethod;
        this.statusCallback = builder.statusCallback;
        this.statusCallbackMethod = builder.statusCallbackMethod;
        this.timeLimit = builder.timeLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static UpdateCallBody redirect(String url) {
        return builder().url(url).build();
    }

    public static UpdateCallBody twiml(String twiml) {
        return builder().twiml(twiml).build();
    }

    public static UpdateCallBody hangUp() {
        return builder().status(TargetStatus.COMPLETED).build();
    }

    @Override
    public List<FormParam> params() {
        return new FormWriter()
            .optional("Url", url())
            .optional("Twiml", twiml())
            .optional("Method", method())
            .optional("Status", status())
            .optional("FallbackUrl", fallbackUrl())
            .optional("FallbackMethod", fallbackMethod())
            .optional("StatusCallback", statusCallback())
            .optional("StatusCallbackMethod", statusCallbackMethod())
            .optional("TimeLimit", timeLimit())
            .build();
    }

    public Optional<String> url() {
        return Optional.ofNullable(url);
    }

    public Optional<String> twiml() {
        return Optional.ofNullable(twiml);
    }

    public Optional<CallbackMethod> method() {
        return Optional.ofNullable(method);
    }

    public Optional<TargetStatus> status() {
        return Optional.ofNullable(status);
    }

    public Optional<String> fallbackUrl() {
        return Optional.ofNullable(fallbackUrl);
    }

    public Optional<CallbackMethod> fallbackMethod() {
        return Optional.ofNullable(fallbackMethod);
    }

    public Optional<String> statusCallback() {
        return Optional.ofNullable(statusCallback);
    }

    public Optional<CallbackMethod> statusCallbackMethod() {
        return Optional.ofNullable(statusCallbackMethod);
    }

    public Optional<Integer> timeLimit() {
        return Optional.ofNullable(timeLimit);
    }

    public static final class Builder {
        private String url;
        private String twiml;
        private CallbackMethod method;
        private TargetStatus status;
        private String fallbackUrl;
        private CallbackMethod fallbackMethod;
        private String statusCallback;
        private CallbackMethod statusCallbackMethod;
        private Integer timeLimit;

        private Builder() {
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder twiml(String twiml) {
            this.twiml = twiml;
            return this;
        }

        public Builder method(CallbackMethod method) {
            this.method = method;
            return this;
        }

        public Builder status(TargetStatus status) {
            this.status = status;
            return this;
        }

        public Builder fallbackUrl(String fallbackUrl) {
            this.fallbackUrl = fallbackUrl;
            return this;
        }

        public Builder fallbackMethod(CallbackMethod fallbackMethod) {
            this.fallbackMethod = fallbackMethod;
            return this;
        }

        public Builder statusCallback(String statusCallback) {
            this.statusCallback = statusCallback;
            return this;
        }

        public Builder statusCallbackMethod(CallbackMethod statusCallbackMethod) {
            this.statusCallbackMethod = statusCallbackMethod;
            return this;
        }

        public Builder timeLimit(int timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        public UpdateCallBody build() {
            return new UpdateCallBody(this);
        }
    }
}
