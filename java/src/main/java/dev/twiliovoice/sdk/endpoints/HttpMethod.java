package dev.twiliovoice.sdk.endpoints;

/**
 * HTTP verbs used by the Twilio REST API.
 */
public enum HttpMethod {
    GET,
    POST,
    DELETE
}
