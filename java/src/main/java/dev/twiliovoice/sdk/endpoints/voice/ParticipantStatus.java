package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ParticipantStatus {
    @JsonProperty("queued")
    QUEUED,
    @JsonProperty("connecting")
    CONNECTING,
    @JsonProperty("ringing")
    RINGING,
    @JsonProperty("connected")
    CONNECTED,
    @JsonProperty("complete")
    COMPLETE,
    @JsonProperty("failed")
    FAILED
}
