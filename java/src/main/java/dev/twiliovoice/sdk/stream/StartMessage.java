package dev.twiliovoice.sdk.stream;

import java.util.List;
import java.util.Map;

/**
 * Stream metadata, sent once after {@code connected}. {@code customParameters} carries the {@code <Parameter>}
 * values from the TwiML or REST request that opened the stream.
 */
public record StartMessage(String sequenceNumber, String streamSid, Start start) implements StreamMessage {

    public record Start(
        String accountSid,
        String streamSid,
        String callSid,
        List<String> tracks,
        MediaFormat mediaFormat,
        Map<String, String> customParameters
    ) {

        public Start {
            tracks = tracks == null ? List.of() : List.copyOf(tracks);
            customParameters = customParameters == null ? Map.of() : Map.copyOf(customParameters);
        }
    }

    public record MediaFormat(String encoding, Integer sampleRate, Integer channels) {
    }
}
