package dev.twiliovoice.sdk.endpoints.applications;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.ApiVersion;

/**
 * TwiML application: a reusable set of voice and messaging URLs that calls can point at through an
 * {@code ApplicationSid}.
 */
public record ApplicationResource(
    String sid,
    @JsonProperty("account_sid") String accountSid,
    @JsonProperty("api_version") ApiVersion apiVersion,
    @JsonProperty("date_created") String dateCreated,
    @JsonProperty("date_updated") String dateUpdated,
    @JsonProperty("friendly_name") String friendlyName,
    @JsonProperty("message_status_callback") String messageStatusCallback,
    @JsonProperty("sms_fallback_method") String smsFallbackMethod,
    @JsonProperty("sms_fallback_url") String smsFallbackUrl,
    @JsonProperty("sms_method") String smsMethod,
    @JsonProperty("sms_status_callback") String smsStatusCallback,
    @JsonProperty("sms_url") String smsUrl,
    @JsonProperty("status_callback") String statusCallback,
    @JsonProperty("status_callback_method") String statusCallbackMethod,
    String uri,
    @JsonProperty("voice_caller_id_lookup") Boolean voiceCallerIdLookup,
    @JsonProperty("voice_fallback_method") String voiceFallbackMethod,
    @JsonProperty("voice_fallback_url") String voiceFallbackUrl,
    @JsonProperty("voice_method") String voiceMethod,
    @JsonProperty("voice_url") String voiceUrl,
    @JsonProperty("public_application_connect_enabled") Boolean publicApplicationConnectEnabled
) {
}
