package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.WireValue;

public enum StreamStatus implements WireValue {
    @JsonProperty("in-progress")
    IN_PROGRESS("in-progress"),
    @JsonProperty("stopped")
    STOPPED("stopped");

    private final String wireValue;

    StreamStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
