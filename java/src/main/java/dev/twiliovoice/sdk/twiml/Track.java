package dev.twiliovoice.sdk.twiml;

/**
 * Audio legs a {@code <Stream>} forks to the WebSocket.
 */
public enum Track {
    INBOUND_TRACK("inbound_track"),
    OUTBOUND_TRACK("outbound_track"),
    BOTH_TRACKS("both_tracks");

    private final String attributeValue;

    Track(String attributeValue) {
        this.attributeValue = attributeValue;
    }

    public String attributeValue() {
        return attributeValue;
    }
}
