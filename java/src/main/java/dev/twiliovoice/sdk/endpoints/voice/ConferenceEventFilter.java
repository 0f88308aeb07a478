package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.WireValue;

/**
 * Conference events a participant's {@code ConferenceStatusCallback} can subscribe to.
 */
public enum ConferenceEventFilter implements WireValue {
    START("start"),
    END("end"),
    JOIN("join"),
    LEAVE("leave"),
    MUTE("mute"),
    HOLD("hold"),
    MODIFY("modify"),
    SPEAKER("speaker"),
    ANNOUNCEMENT("announcement");

    private final String wireValue;

    ConferenceEventFilter(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
