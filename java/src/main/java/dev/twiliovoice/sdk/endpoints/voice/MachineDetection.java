package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.WireValue;

public enum MachineDetection implements WireValue {
    /** Return as soon as a human or machine is recognised. */
    ENABLE("Enable"),
    /** Wait for the end of a machine greeting before returning. */
    DETECT_MESSAGE_END("DetectMessageEnd");

    private final String wireValue;

    MachineDetection(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
