package dev.twiliovoice.sdk.stream;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One JSON frame exchanged over a media stream WebSocket. The {@code event} field selects the concrete type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ConnectedMessage.class, name = "connected"),
    @JsonSubTypes.Type(value = StartMessage.class, name = "start"),
    @JsonSubTypes.Type(value = MediaMessage.class, name = "media"),
    @JsonSubTypes.Type(value = MarkMessage.class, name = "mark"),
    @JsonSubTypes.Type(value = StopMessage.class, name = "stop"),
    @JsonSubTypes.Type(value = DtmfMessage.class, name = "dtmf"),
    @JsonSubTypes.Type(value = ClearMessage.class, name = "clear")
})
public interface StreamMessage {

    /**
     * @return SID of the stream, absent only on {@code connected}.
     */
    String streamSid();
}
