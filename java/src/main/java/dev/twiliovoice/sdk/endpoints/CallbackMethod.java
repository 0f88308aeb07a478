package dev.twiliovoice.sdk.endpoints;

/**
 * Verb Twilio uses when it calls back into your application (TwiML fetches, status callbacks).
 */
public enum CallbackMethod implements WireValue {
    GET,
    POST;

    @Override
    public String wireValue() {
        return name();
    }
}
