package dev.twiliovoice.sdk.stream;

import java.util.Base64;

/**
 * A chunk of audio. Inbound frames carry track, chunk and timestamp; outbound frames only the payload.
 */
public record MediaMessage(String sequenceNumber, String streamSid, Media media) implements StreamMessage {

    /**
     * @param payload base64 encoded audio, {@code audio/x-mulaw} at 8000 Hz.
     */
    public record Media(String track, String chunk, String timestamp, String payload) {

        public byte[] decodePayload() {
            return payload == null ? new byte[0] : Base64.getDecoder().decode(payload);
        }
    }
}
