package dev.twiliovoice.sdk.stream;

/**
 * Key press detected on a bidirectional stream.
 */
public record DtmfMessage(String sequenceNumber, String streamSid, Dtmf dtmf) implements StreamMessage {

    public record Dtmf(String track, String digit) {
    }
}
