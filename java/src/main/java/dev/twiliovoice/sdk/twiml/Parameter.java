package dev.twiliovoice.sdk.twiml;

import java.util.Objects;

/**
 * Custom key/value pair nested in a {@code <Stream>}; it reaches the WebSocket in the {@code start} message.
 */
public record Parameter(String name, String value) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
