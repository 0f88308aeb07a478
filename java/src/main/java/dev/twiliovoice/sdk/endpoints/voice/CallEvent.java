package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.WireValue;

/**
 * Call progress events that can be delivered to a status callback. When none is requested Twilio only reports
 * {@link #COMPLETED}.
 */
public enum CallEvent implements WireValue {
    INITIATED("initiated"),
    RINGING("ringing"),
    ANSWERED("answered"),
    COMPLETED("completed");

    private final String wireValue;

    CallEvent(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
