package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.WireValue;

public enum RecordingEvent implements WireValue {
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    ABSENT("absent");

    private final String wireValue;

    RecordingEvent(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
