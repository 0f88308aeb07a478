package dev.twiliovoice.sdk.endpoints;

import dev.twiliovoice.sdk.internal.HttpUtil;
import dev.twiliovoice.sdk.internal.Json;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Describes one API action: where it lives, which verb it uses, what it sends and what it answers with.
 *
 * <p>
 * {@link dev.twiliovoice.sdk.TwilioClient#hit(Endpoint)} is generic over this type and never needs to know which
 * concrete action it is dispatching. Each action is its own (usually record) implementation carrying the identifiers
 * interpolated into {@link #pathTemplate()} and its typed {@link RequestBody}.
 * </p>
 *
 * @param <B> request body type.
 * @param <R> decoded response type; {@link Void} for actions answering with an empty body.
 */
public interface Endpoint<B extends RequestBody, R> {

    String API_VERSION_PREFIX = "/2010-04-01";

    HttpMethod method();

    /**
     * @return path below the API host with {@code {Name}} placeholders, e.g.
     * {@code /2010-04-01/Accounts/{AccountSid}/Calls.json}.
     */
    String pathTemplate();

    /**
     * @return placeholder name (without braces) to value.
     */
    Map<String, String> pathParams();

    default List<FormParam> queryParams() {
        return List.of();
    }

    B body();

    Class<R> responseType();

    /**
     * Decodes a success body. Actions whose response type is {@link Void} ignore the body.
     */
    default R readResponse(byte[] body) throws IOException {
        if (responseType() == Void.class) {
            return null;
        }
        return Json.mapper().readValue(body, responseType());
    }

    /**
     * Interpolates {@link #pathParams()} into {@link #pathTemplate()}.
     *
     * @throws IllegalStateException when a placeholder is left unresolved.
     */
    default String path() {
        String path = pathTemplate();
        for (Map.Entry<String, String> param : pathParams().entrySet()) {
            path = path.replace("{" + param.getKey() + "}", HttpUtil.encodePathSegment(param.getValue()));
        }
        int open = path.indexOf('{');
        if (open >= 0) {
            throw new IllegalStateException("unresolved path parameter in " + path);
        }
        return path;
    }

    default URI uri(String baseUrl) {
        StringBuilder target = new StringBuilder(baseUrl).append(path());
        List<FormParam> query = queryParams();
        if (!query.isEmpty()) {
            target.append('?').append(query.stream()
                .map(param -> HttpUtil.encode(param.name()) + '=' + HttpUtil.encode(param.value()))
                .collect(Collectors.joining("&")));
        }
        return URI.create(target.toString());
    }

    /**
     * Guard used by action constructors for the identifiers they interpolate into the path.
     */
    static String requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }
}
