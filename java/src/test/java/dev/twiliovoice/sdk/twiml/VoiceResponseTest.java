package dev.twiliovoice.sdk.twiml;

import dev.twiliovoice.sdk.TwimlException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VoiceResponseTest {

    private static final String PROLOG = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    @Test
    void connectStreamRendersSelfClosedNoun() throws Exception {
        String xml = new VoiceResponse().connect("wss://test.com/connect").toXml();

        assertEquals(PROLOG + "<Response><Connect><Stream url=\"wss://test.com/connect\" /></Connect></Response>", xml);
    }

    @Test
    void nonWebSocketUrlIsRejected() {
        VoiceResponse response = new VoiceResponse().connect("https://test.com/connect");

        assertThrows(TwimlException.class, response::toXml);
    }

    @Test
    void allStreamAttributesAreRendered() throws Exception {
        Stream stream = Stream.builder()
            .url("wss://test.com/connect")
            .name("test")
            .track(Track.INBOUND_TRACK)
            .statusCallback("https://test.com/callback")
            .statusCallbackMethod("POST")
            .build();

        String xml = new VoiceResponse().connect(stream).toXml();

        assertEquals(PROLOG + "<Response><Connect><Stream url=\"wss://test.com/connect\" name=\"test\" "
            + "track=\"inbound_track\" statusCallback=\"https://test.com/callback\" statusCallbackMethod=\"POST\" />"
            + "</Connect></Response>", xml);
    }

    @Test
    void parametersNestInsideStream() throws Exception {
        Stream stream = Stream.builder()
            .url("wss://mystream.ngrok.io/example")
            .parameter("FirstName", "Jane")
            .parameter("LastName", "Doe")
            .build();

        String xml = new VoiceResponse().connect(stream).toXml();

        assertEquals(PROLOG + "<Response><Connect><Stream url=\"wss://mystream.ngrok.io/example\">"
            + "<Parameter name=\"FirstName\" value=\"Jane\" /><Parameter name=\"LastName\" value=\"Doe\" />"
            + "</Stream></Connect></Response>", xml);
    }

    @Test
    void rejectRendersEmptyVerb() throws Exception {
        assertEquals(PROLOG + "<Response><Reject /></Response>", new VoiceResponse().reject().toXml());
    }

    @Test
    void attributeValuesAreEscaped() throws Exception {
        Stream stream = Stream.builder()
            .url("wss://test.com/connect")
            .parameter("Note", "a<b & \"c\"/>")
            .build();

        String xml = new VoiceResponse().connect(stream).toXml();

        assertTrue(xml.contains("value=\"a&lt;b &amp; &quot;c&quot;/&gt;\" />"), xml);
    }

    @Test
    void builderValidatesUrls() {
        assertThrows(TwimlException.class, () -> Stream.builder().url("ws://insecure.example.com"));
        assertThrows(TwimlException.class, () -> Stream.builder().url("wss://bad host"));
        assertThrows(TwimlException.class, () -> Stream.builder().statusCallback("not a url"));
        assertThrows(TwimlException.class, () -> Stream.builder().build());
    }

    @Test
    void emptyResponseIsStillADocument() throws Exception {
        assertEquals(PROLOG + "<Response></Response>", new VoiceResponse().toXml());
    }
}
