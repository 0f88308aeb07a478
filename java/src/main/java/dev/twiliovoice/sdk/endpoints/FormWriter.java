package dev.twiliovoice.sdk.endpoints;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates form parameters for a {@link RequestBody}. Absent optionals and empty collections are skipped, so an
 * unset option never reaches the wire as an empty value.
 */
public final class FormWriter {

    private final List<FormParam> params = new ArrayList<>();

    public FormWriter required(String name, Object value) {
        Objects.requireNonNull(value, name);
        params.add(new FormParam(name, toWire(value)));
        return this;
    }

    public FormWriter optional(String name, Optional<?> value) {
        value.ifPresent(v -> params.add(new FormParam(name, toWire(v))));
        return this;
    }

    /**
     * Emits one parameter per element, which is how the API receives multi-valued options such as
     * {@code StatusCallbackEvent}.
     */
    public FormWriter repeated(String name, Collection<?> values) {
        if (values == null) {
            return this;
        }
        for (Object value : values) {
            if (value != null) {
                params.add(new FormParam(name, toWire(value)));
            }
        }
        return this;
    }

    public FormWriter all(Collection<FormParam> extra) {
        if (extra != null) {
            params.addAll(extra);
        }
        return this;
    }

    public List<FormParam> build() {
        return List.copyOf(params);
    }

    static String toWire(Object value) {
        if (value instanceof WireValue) {
            return ((WireValue) value).wireValue();
        }
        return String.valueOf(value);
    }
}
