package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.WireValue;

public enum ConferenceStatus implements WireValue {
    @JsonProperty("init")
    INIT("init"),
    @JsonProperty("in-progress")
    IN_PROGRESS("in-progress"),
    @JsonProperty("completed")
    COMPLETED("completed");

    private final String wireValue;

    ConferenceStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
