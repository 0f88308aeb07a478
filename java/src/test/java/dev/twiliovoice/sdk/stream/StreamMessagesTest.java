package dev.twiliovoice.sdk.stream;

import com.fasterxml.jackson.databind.JsonNode;
import dev.twiliovoice.sdk.DeserializationException;
import dev.twiliovoice.sdk.internal.Json;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class StreamMessagesTest {

    @Test
    void parsesConnected() throws Exception {
        StreamMessage message =
            StreamMessages.parse("{\"event\":\"connected\",\"protocol\":\"Call\",\"version\":\"1.0.0\"}");

        ConnectedMessage connected = assertInstanceOf(ConnectedMessage.class, message);
        assertEquals("Call", connected.protocol());
        assertNull(connected.streamSid());
    }

    @Test
    void parsesStartWithCustomParameters() throws Exception {
        String frame = "{\"event\":\"start\",\"sequenceNumber\":\"1\",\"streamSid\":\"MZ1\",\"start\":{"
            + "\"accountSid\":\"AC1\",\"streamSid\":\"MZ1\",\"callSid\":\"CA1\",\"tracks\":[\"inbound\"],"
            + "\"customParameters\":{\"FirstName\":\"Jane\"},"
            + "\"mediaFormat\":{\"encoding\":\"audio/x-mulaw\",\"sampleRate\":8000,\"channels\":1}}}";

        StartMessage start = assertInstanceOf(StartMessage.class, StreamMessages.parse(frame));

        assertEquals("MZ1", start.streamSid());
        assertEquals("CA1", start.start().callSid());
        assertEquals("Jane", start.start().customParameters().get("FirstName"));
        assertEquals(8000, start.start().mediaFormat().sampleRate());
    }

    @Test
    void parsesMediaPayload() throws Exception {
        String frame = "{\"event\":\"media\",\"sequenceNumber\":\"3\",\"streamSid\":\"MZ1\",\"media\":{"
            + "\"track\":\"inbound\",\"chunk\":\"1\",\"timestamp\":\"5\",\"payload\":\"AQID\"}}";

        MediaMessage media = assertInstanceOf(MediaMessage.class, StreamMessages.parse(frame));

        assertArrayEquals(new byte[] {1, 2, 3}, media.media().decodePayload());
        assertEquals("inbound", media.media().track());
    }

    @Test
    void parsesMarkStopAndDtmf() throws Exception {
        MarkMessage mark = assertInstanceOf(MarkMessage.class,
            StreamMessages.parse("{\"event\":\"mark\",\"streamSid\":\"MZ1\",\"mark\":{\"name\":\"greeting\"}}"));
        StopMessage stop = assertInstanceOf(StopMessage.class,
            StreamMessages.parse("{\"event\":\"stop\",\"streamSid\":\"MZ1\",\"stop\":{\"callSid\":\"CA1\"}}"));
        DtmfMessage dtmf = assertInstanceOf(DtmfMessage.class,
            StreamMessages.parse("{\"event\":\"dtmf\",\"streamSid\":\"MZ1\","
                + "\"dtmf\":{\"track\":\"inbound_track\",\"digit\":\"5\"}}"));

        assertEquals("greeting", mark.mark().name());
        assertEquals("CA1", stop.stop().callSid());
        assertEquals("5", dtmf.dtmf().digit());
    }

    @Test
    void unknownEventIsRejected() {
        assertThrows(DeserializationException.class, () -> StreamMessages.parse("{\"event\":\"teleport\"}"));
        assertThrows(DeserializationException.class, () -> StreamMessages.parse("{\"streamSid\":\"MZ1\"}"));
        assertThrows(DeserializationException.class, () -> StreamMessages.parse("not json"));
    }

    @Test
    void writesOutboundMedia() throws Exception {
        String frame = StreamMessages.write(StreamMessages.media("MZ1", "hi".getBytes(StandardCharsets.UTF_8)));

        JsonNode node = Json.mapper().readTree(frame);
        assertEquals("media", node.path("event").asText());
        assertEquals("MZ1", node.path("streamSid").asText());
        assertEquals("aGk=", node.path("media").path("payload").asText());
        assertFalse(node.path("media").has("track"));
        assertFalse(node.has("sequenceNumber"));
    }

    @Test
    void writesMarkAndClear() throws Exception {
        JsonNode mark = Json.mapper().readTree(StreamMessages.write(StreamMessages.mark("MZ1", "end-of-greeting")));
        JsonNode clear = Json.mapper().readTree(StreamMessages.write(StreamMessages.clear("MZ1")));

        assertEquals("mark", mark.path("event").asText());
        assertEquals("end-of-greeting", mark.path("mark").path("name").asText());
        assertEquals("clear", clear.path("event").asText());
        assertEquals("MZ1", clear.path("streamSid").asText());
    }
}
