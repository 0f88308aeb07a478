package dev.twiliovoice.sdk.endpoints;

import java.util.List;

/**
 * Body of requests that carry no payload (fetch, list and delete actions).
 */
public final class EmptyBody implements RequestBody {

    public static final EmptyBody INSTANCE = new EmptyBody();

    private EmptyBody() {
    }

    @Override
    public List<FormParam> params() {
        return List.of();
    }

    @Override
    public String toString() {
        return "EmptyBody";
    }
}
