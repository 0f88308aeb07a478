package dev.twiliovoice.sdk.webhook;

import dev.twiliovoice.sdk.DeserializationException;
import dev.twiliovoice.sdk.internal.Json;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes the form parameters Twilio posts to application webhooks. Signature verification is left to the hosting web
 * framework.
 */
public final class WebhookRequests {

    private WebhookRequests() {
    }

    public static CallWebhook call(Map<String, String> params) throws DeserializationException {
        CallWebhook webhook = convert(params, CallWebhook.class);
        requirePresent(webhook.callSid(), "CallSid");
        requirePresent(webhook.accountSid(), "AccountSid");
        requirePresent(webhook.from(), "From");
        requirePresent(webhook.to(), "To");
        requirePresent(webhook.callStatus(), "CallStatus");
        requirePresent(webhook.apiVersion(), "ApiVersion");
        requirePresent(webhook.direction(), "Direction");
        return webhook;
    }

    public static ConferenceWebhook conference(Map<String, String> params) throws DeserializationException {
        ConferenceWebhook webhook = convert(params, ConferenceWebhook.class);
        requirePresent(webhook.conferenceSid(), "ConferenceSid");
        requirePresent(webhook.friendlyName(), "FriendlyName");
        requirePresent(webhook.accountSid(), "AccountSid");
        requirePresent(webhook.sequenceNumber(), "SequenceNumber");
        requirePresent(webhook.timestamp(), "Timestamp");
        return webhook;
    }

    public static AmdWebhook amd(Map<String, String> params) throws DeserializationException {
        AmdWebhook webhook = convert(params, AmdWebhook.class);
        requirePresent(webhook.callSid(), "CallSid");
        requirePresent(webhook.accountSid(), "AccountSid");
        requirePresent(webhook.answeredBy(), "AnsweredBy");
        return webhook;
    }

    /**
     * Splits an {@code application/x-www-form-urlencoded} request body. When a name repeats, the last value wins.
     */
    public static Map<String, String> parseForm(String body) {
        Map<String, String> params = new LinkedHashMap<>();
        if (body == null || body.isEmpty()) {
            return params;
        }
        for (String pair : body.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(name, StandardCharsets.UTF_8),
                URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static <T> T convert(Map<String, String> params, Class<T> type) throws DeserializationException {
        Objects.requireNonNull(params, "params");
        try {
            return Json.mapper().convertValue(params, type);
        } catch (IllegalArgumentException ex) {
            throw new DeserializationException("decode " + type.getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }

    private static void requirePresent(Object value, String name) throws DeserializationException {
        if (value == null) {
            throw new DeserializationException("webhook parameter " + name + " is missing", null);
        }
    }
}
