package dev.twiliovoice.sdk.endpoints;

import java.util.List;

/**
 * Payload of a single API action. Implementations decide which of their fields are sent: required fields always,
 * optional fields only when they have been set.
 */
public interface RequestBody {

    /**
     * @return ordered form parameters; an empty list means the request carries no body.
     */
    List<FormParam> params();
}
