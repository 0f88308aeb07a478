package dev.twiliovoice.sdk.endpoints;

/**
 * Implemented by enums whose wire spelling differs from their Java constant name.
 */
public interface WireValue {

    String wireValue();
}
