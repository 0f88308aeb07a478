package dev.twiliovoice.sdk.endpoints;

import java.util.Objects;

/**
 * Single name/value pair of a form body or query string.
 */
public record FormParam(String name, String value) {

    public FormParam {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
