package dev.twiliovoice.sdk.stream;

/**
 * First frame on a new socket, sent before the stream SID is known.
 */
public record ConnectedMessage(String protocol, String version) implements StreamMessage {

    @Override
    public String streamSid() {
        return null;
    }
}
