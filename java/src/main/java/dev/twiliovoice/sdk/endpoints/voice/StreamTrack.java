package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.WireValue;

/**
 * Audio legs forked to a media stream.
 */
public enum StreamTrack implements WireValue {
    INBOUND_TRACK("inbound_track"),
    OUTBOUND_TRACK("outbound_track"),
    BOTH_TRACKS("both_tracks");

    private final String wireValue;

    StreamTrack(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
