package dev.twiliovoice.sdk.stream;

public record StopMessage(String sequenceNumber, String streamSid, Stop stop) implements StreamMessage {

    public record Stop(String accountSid, String callSid) {
    }
}
