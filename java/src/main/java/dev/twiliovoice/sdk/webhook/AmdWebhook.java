package dev.twiliovoice.sdk.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.voice.AnsweredBy;

/**
 * Asynchronous answering machine detection result, posted to {@code AsyncAmdStatusCallback}.
 */
public record AmdWebhook(
    @JsonProperty("CallSid") String callSid,
    @JsonProperty("AccountSid") String accountSid,
    @JsonProperty("AnsweredBy") AnsweredBy answeredBy,
    @JsonProperty("MachineDetectionDuration") Integer machineDetectionDuration
) {
}
