package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.WireValue;

/**
 * Lifecycle states of a call.
 */
public enum CallStatus implements WireValue {
    @JsonProperty("queued")
    QUEUED("queued"),
    @JsonProperty("ringing")
    RINGING("ringing"),
    @JsonProperty("in-progress")
    IN_PROGRESS("in-progress"),
    @JsonProperty("canceled")
    CANCELED("canceled"),
    @JsonProperty("completed")
    COMPLETED("completed"),
    @JsonProperty("failed")
    FAILED("failed"),
    @JsonProperty("busy")
    BUSY("busy"),
    @JsonProperty("no-answer")
    NO_ANSWER("no-answer");

    private final String wireValue;

    CallStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != QUEUED && this != RINGING && this != IN_PROGRESS;
    }
}
