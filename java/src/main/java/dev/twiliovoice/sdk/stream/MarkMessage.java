package dev.twiliovoice.sdk.stream;

/**
 * Marks a point in the outbound audio. Twilio echoes the mark back once the audio before it has played.
 */
public record MarkMessage(String sequenceNumber, String streamSid, Mark mark) implements StreamMessage {

    public record Mark(String name) {
    }
}
