package dev.twiliovoice.sdk.twiml;

import dev.twiliovoice.sdk.TwimlException;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a voice TwiML document.
 *
 * <pre>{@code
 * String xml = new VoiceResponse()
 *     .connect("wss://media.example.com/socket")
 *     .toXml();
 * }</pre>
 *
 * <p>
 * Verbs are rendered in the order they were added. Instances are mutable and not thread-safe.
 * </p>
 */
public final class VoiceResponse {

    public static final String CONTENT_TYPE = "application/xml";

    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();

    private final List<Verb> verbs = new ArrayList<>();

    public VoiceResponse connect(String streamUrl) {
        return connect(Stream.of(streamUrl));
    }

    public VoiceResponse connect(Stream stream) {
        Objects.requireNonNull(stream, "stream");
        verbs.add(writer -> writeConnect(writer, stream));
        return this;
    }

    public VoiceResponse reject() {
        verbs.add(writer -> writer.writeEmptyElement("Reject"));
        return this;
    }

    /**
     * Renders the document, prefixed with the XML declaration.
     *
     * @throws TwimlException when a stream URL is not a valid {@code wss://} URL or the XML cannot be written.
     */
    public String toXml() throws TwimlException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter writer = OUTPUT_FACTORY.createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
            writer.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            writer.writeStartElement("Response");
            for (Verb verb : verbs) {
                verb.write(writer);
            }
            writer.writeEndElement();
            writer.writeEndDocument();
            writer.flush();
            writer.close();
        } catch (XMLStreamException ex) {
            throw new TwimlException("write TwiML: " + ex.getMessage(), ex);
        }
        // Attribute values are escaped, so every "/>" closes an empty element.
        return out.toString(StandardCharsets.UTF_8).replace("/>", " />");
    }

    @Override
    public String toString() {
        return "VoiceResponse{verbs=" + verbs.size() + '}';
    }

    private static void writeConnect(XMLStreamWriter writer, Stream stream) throws XMLStreamException, TwimlException {
        String url = Stream.requireWebSocketUrl(stream.url());
        writer.writeStartElement("Connect");
        if (stream.parameters().isEmpty()) {
            writer.writeEmptyElement("Stream");
        } else {
            writer.writeStartElement("Stream");
        }
        writer.writeAttribute("url", url);
        if (stream.name().isPresent()) {
            writer.writeAttribute("name", stream.name().get());
        }
        if (stream.track().isPresent()) {
            writer.writeAttribute("track", stream.track().get().attributeValue());
        }
        if (stream.statusCallback().isPresent()) {
            writer.writeAttribute("statusCallback", stream.statusCallback().get());
        }
        if (stream.statusCallbackMethod().isPresent()) {
            writer.writeAttribute("statusCallbackMethod", stream.statusCallbackMethod().get());
        }
        if (!stream.parameters().isEmpty()) {
            for (Parameter parameter : stream.parameters()) {
                writer.writeEmptyElement("Parameter");
                writer.writeAttribute("name", parameter.name());
                writer.writeAttribute("value", parameter.value());
            }
            writer.writeEndElement();
        }
        writer.writeEndElement();
    }

    @FunctionalInterface
    private interface Verb {
        void write(XMLStreamWriter writer) throws XMLStreamException, TwimlException;
    }
}
