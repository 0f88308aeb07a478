package dev.twiliovoice.sdk.endpoints.applications;

import dev.twiliovoice.sdk.endpoints.ApiVersion;
import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.FormWriter;
import dev.twiliovoice.sdk.endpoints.RequestBody;

import java.util.List;
import java.util.Optional;

/**
 * Payload shared by the create and update application actions. Every field is optional; on update, only the fields
 * that are set are changed.
 */
public final class ApplicationBody implements RequestBody {

    private final String friendlyName;
    private final ApiVersion apiVersion;
    private final String voiceUrl;
    private final CallbackMethod voiceMethod;
    private final String voiceFallbackUrl;
    private final CallbackMethod voiceFallbackMethod;
    private final Boolean voiceCallerIdLookup;
    private final String statusCallback;
    private final CallbackMethod statusCallbackMethod;
    private final String smsUrl;
    private final CallbackMethod smsMethod;
    private final String smsFallbackUrl;
    private final CallbackMethod smsFallbackMethod;
    private final String messageStatusCallback;
    private final Boolean publicApplicationConnectEnabled;

    private ApplicationBody(Builder builder) {
        this.friendlyName = builder.friendlyName;
        this.apiVersion = builder.apiVersion;
        this.voiceUrl = builder.voiceUrl;
        this.voiceMethod = builder.voiceMethod;
        this.voiceFallbackUrl = builder.voiceFallbackUrl;
        this.voiceFallbackMethod = builder.voiceFallbackMethod;
        this.voiceCallerIdLookup = builder.voiceCallerIdLookup;
        this.statusCallback = builder.statusCallback;
        this.statusCallbackMethod = builder.statusCallbackMethod;
        this.smsUrl = builder.smsUrl;
        this.smsMethod = builder.smsMethod;
        this.smsFallbackUrl = builder.smsFallbackUrl;
        this.smsFallbackMethod = builder.smsFallbackMethod;
        this.messageStatusCallback = builder.messageStatusCallback;
        this.publicApplicationConnectEnabled = builder.publicApplicationConnectEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<FormParam> params() {
        return new FormWriter()
            .optional("FriendlyName", friendlyName())
            .optional("ApiVersion", apiVersion())
            .optional("VoiceUrl", voiceUrl())
            .optional("VoiceMethod", voiceMethod())
            .optional("VoiceFallbackUrl", voiceFallbackUrl())
            .optional("VoiceFallbackMethod", voiceFallbackMethod())
            .optional("VoiceCallerIdLookup", voiceCallerIdLookup())
            .optional("StatusCallback", statusCallback())
            .optional("StatusCallbackMethod", statusCallbackMethod())
            .optional("SmsUrl", smsUrl())
            .optional("SmsMethod", smsMethod())
            .optional("SmsFallbackUrl", smsFallbackUrl())
            .optional("SmsFallbackMethod", smsFallbackMethod())
            .optional("MessageStatusCallback", messageStatusCallback())
            .optional("PublicApplicationConnectEnabled", publicApplicationConnectEnabled())
            .build();
    }

    public Optional<String> friendlyName() {
        return Optional.ofNullable(friendlyName);
    }

    public Optional<ApiVersion> apiVersion() {
        return Optional.ofNullable(apiVersion);
    }

    public Optional<String> voiceUrl() {
        return Optional.ofNullable(voiceUrl);
    }

    public Optional<CallbackMethod> voiceMethod() {
        return Optional.ofNullable(voiceMethod);
    }

    public Optional<String> voiceFallbackUrl() {
        return Optional.ofNullable(voiceFallbackUrl);
    }

    public Optional<CallbackMethod> voiceFallbackMethod() {
        return Optional.ofNullable(voiceFallbackMethod);
    }

    public Optional<Boolean> voiceCallerIdLookup() {
        return Optional.ofNullable(voiceCallerIdLookup);
    }

    public Optional<String> statusCallback() {
        return Optional.ofNullable(statusCallback);
    }

    public Optional<CallbackMethod> statusCallbackMethod() {
        return Optional.ofNullable(statusCallbackMethod);
    }

    public Optional<String> smsUrl() {
        return Optional.ofNullable(smsUrl);
    }

    public Optional<CallbackMethod> smsMethod() {
        return Optional.ofNullable(smsMethod);
    }

    public Optional<String> smsFallbackUrl() {
        return Optional.ofNullable(smsFallbackUrl);
    }

    public Optional<CallbackMethod> smsFallbackMethod() {
        return Optional.ofNullable(smsFallbackMethod);
    }

    public Optional<String> messageStatusCallback() {
        return Optional.ofNullable(messageStatusCallback);
    }

    public Optional<Boolean> publicApplicationConnectEnabled() {
        return Optional.ofNullable(publicApplicationConnectEnabled);
    }

    public static final class Builder {
        private String friendlyName;
        private ApiVersion apiVersion;
        private String voiceUrl;
        private CallbackMethod voiceMethod;
        private String voiceFallbackUrl;
        private CallbackMethod voiceFallbackMethod;
        private Boolean voiceCallerIdLookup;
        private String statusCallback;
        private CallbackMethod statusCallbackMethod;
        private String smsUrl;
        private CallbackMethod smsMethod;
        private String smsFallbackUrl;
        private CallbackMethod smsFallbackMethod;
        private String messageStatusCallback;
        private Boolean publicApplicationConnectEnabled;

        private Builder() {
        }

        public Builder friendlyName(String friendlyName) {
            this.friendlyName = friendlyName;
            return this;
        }

        public Builder apiVersion(ApiVersion apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder voiceUrl(String voiceUrl) {
            this.voiceUrl = voiceUrl;
            return this;
        }

        public Builder voiceMethod(CallbackMethod voiceMethod) {
            this.voiceMethod = voiceMethod;
            return this;
        }

        public Builder voiceFallbackUrl(String voiceFallbackUrl) {
            this.voiceFallbackUrl = voiceFallbackUrl;
            return this;
        }

        public Builder voiceFallbackMethod(CallbackMethod voiceFallbackMethod) {
            this.voiceFallbackMethod = voiceFallbackMethod;
            return this;
        }

        public Builder voiceCallerIdLookup(boolean voiceCallerIdLookup) {
            this.voiceCallerIdLookup = voiceCallerIdLookup;
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

        public Builder smsUrl(String smsUrl) {
            this.smsUrl = smsUrl;
            return this;
        }

        public Builder smsMethod(CallbackMethod smsMethod) {
            this.smsMethod = smsMethod;
            return this;
        }

        public Builder smsFallbackUrl(String smsFallbackUrl) {
            this.smsFallbackUrl = smsFallbackUrl;
            return this;
        }

        public Builder smsFallbackMethod(CallbackMethod smsFallbackMethod) {
            this.smsFallbackMethod = smsFallbackMethod;
            return this;
        }

        public Builder messageStatusCallback(String messageStatusCallback) {
            this.messageStatusCallback = messageStatusCallback;
            return this;
        }

        public Builder publicApplicationConnectEnabled(boolean publicApplicationConnectEnabled) {
            this.publicApplicationConnectEnabled = publicApplicationConnectEnabled;
            return this;
        }

        public ApplicationBody build() {
            return new ApplicationBody(this);
        }
    }
}
