package dev.twiliovoice.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.twiliovoice.sdk.TwilioApiException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding Twilio error payloads ({@code {"code":20003,"message":"...","more_info":"...","status":401}}).
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static TwilioApiException decode(int statusCode, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new TwilioApiException(statusCode, null, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            if (node == null || !node.isObject()) {
                return new TwilioApiException(statusCode, null, new String(bytes, StandardCharsets.UTF_8), null);
            }
            Integer code = node.hasNonNull("code") && node.get("code").canConvertToInt() ? node.get("code").asInt() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : null;
            String moreInfo = node.hasNonNull("more_info") ? node.get("more_info").asText() : null;
            return new TwilioApiException(statusCode, code, message, moreInfo);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            return new TwilioApiException(statusCode, null, fallback, null);
        }
    }
}
