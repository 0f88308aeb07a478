package dev.twiliovoice.sdk.stream;

/**
 * Outbound only: discards audio buffered on Twilio's side that has not been played yet.
 */
public record ClearMessage(String streamSid) implements StreamMessage {
}
