package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.WireValue;

public enum RecordingTrack implements WireValue {
    INBOUND("inbound"),
    OUTBOUND("outbound"),
    BOTH("both");

    private final String wireValue;

    RecordingTrack(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
