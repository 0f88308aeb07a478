package dev.twiliovoice.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared ObjectMapper for API responses, webhook parameters and media stream frames.
 *
 * <p>
 * Unknown properties are ignored so new API fields do not break decoding, but unknown enum values are not: a status
 * the SDK cannot represent fails loudly instead of turning into {@code null}. Webhooks post unset parameters as empty
 * strings, which decode to {@code null}. Timestamps stay in the API's RFC 2822 text form, so no date module is
 * registered.
 * </p>
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, false)
        .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
