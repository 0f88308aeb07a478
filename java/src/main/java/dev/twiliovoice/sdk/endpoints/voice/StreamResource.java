package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StreamResource(
    String sid,
    @JsonProperty("account_sid") String accountSid,
    @JsonProperty("call_sid") String callSid,
    String name,
    StreamStatus status,
    @JsonProperty("date_updated") String dateUpdated,
    String uri
) {
}
