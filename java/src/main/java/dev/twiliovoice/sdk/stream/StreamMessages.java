package dev.twiliovoice.sdk.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.twiliovoice.sdk.DeserializationException;
import dev.twiliovoice.sdk.internal.Json;

import java.util.Base64;
import java.util.Objects;

/**
 * Reads and writes media stream WebSocket frames. The socket itself belongs to the application's server.
 */
public final class StreamMessages {

    private StreamMessages() {
    }

    /**
     * @throws DeserializationException when the frame is not JSON, has no known {@code event} or does not match the
     *                                  shape of its event.
     */
    public static StreamMessage parse(String frame) throws DeserializationException {
        Objects.requireNonNull(frame, "frame");
        try {
            return Json.mapper().readValue(frame, StreamMessage.class);
        } catch (JsonProcessingException ex) {
            throw new DeserializationException("decode stream message: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String write(StreamMessage message) throws JsonProcessingException {
        Objects.requireNonNull(message, "message");
        return Json.mapper().writeValueAsString(message);
    }

    /**
     * Audio to play to the caller.
     *
     * @param audio raw {@code audio/x-mulaw} bytes at 8000 Hz; encoded to base64 here.
     */
    public static MediaMessage media(String streamSid, byte[] audio) {
        Objects.requireNonNull(streamSid, "streamSid");
        Objects.requireNonNull(audio, "audio");
        String payload = Base64.getEncoder().encodeToString(audio);
        return new MediaMessage(null, streamSid, new MediaMessage.Media(null, null, null, payload));
    }

    public static MarkMessage mark(String streamSid, String name) {
        Objects.requireNonNull(streamSid, "streamSid");
        Objects.requireNonNull(name, "name");
        return new MarkMessage(null, streamSid, new MarkMessage.Mark(name));
    }

    public static ClearMessage clear(String streamSid) {
        return new ClearMessage(Objects.requireNonNull(streamSid, "streamSid"));
    }
}
