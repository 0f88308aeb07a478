package dev.twiliovoice.sdk.endpoints;

import java.util.ArrayList;
import java.util.List;

/**
 * Base type of list filters. Holds the page parameters every list action accepts; resource specific subclasses add
 * their own filters while keeping the fluent return type.
 *
 * @param <Q> concrete query type returned by the fluent setters.
 */
public abstract class PageQuery<Q extends PageQuery<Q>> {

    private final List<FormParam> params = new ArrayList<>();

    protected abstract Q self();

    public Q pageSize(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("PageSize must be positive");
        }
        return add("PageSize", Integer.toString(pageSize));
    }

    public Q page(int page) {
        if (page < 0) {
            throw new IllegalArgumentException("Page cannot be negative");
        }
        return add("Page", Integer.toString(page));
    }

    public Q pageToken(String pageToken) {
        return add("PageToken", pageToken);
    }

    protected Q add(String name, Object value) {
        if (value != null) {
            params.add(new FormParam(name, FormWriter.toWire(value)));
        }
        return self();
    }

    /**
     * @return snapshot of the parameters collected so far, in insertion order.
     */
    public List<FormParam> params() {
        return List.copyOf(params);
    }
}
