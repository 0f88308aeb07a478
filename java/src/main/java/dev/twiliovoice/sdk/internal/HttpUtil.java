package dev.twiliovoice.sdk.internal;

import dev.twiliovoice.sdk.endpoints.FormParam;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Helper methods for issuing HTTP requests with form-encoded payloads and basic authentication.
 */
public final class HttpUtil {

    public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private HttpUtil() {
    }

    public static HttpResponse<InputStream> sendForm(HttpClient client, String method, URI uri, List<FormParam> params,
                                                     String username, String password, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri);

        if (params == null || params.isEmpty()) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofString(encodeForm(params), StandardCharsets.UTF_8));
            builder.header("Content-Type", FORM_CONTENT_TYPE);
        }

        if (username != null && password != null) {
            builder.header("Authorization", basicAuth(username, password));
        }
        if (timeout != null) {
            builder.timeout(timeout);
        }

        builder.header("Accept", "application/json");

        HttpRequest request = builder.build();
        return client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    /**
     * Encodes parameters as {@code application/x-www-form-urlencoded}, keeping their order. Repeated names are
     * emitted once per value.
     */
    public static String encodeForm(List<FormParam> params) {
        return params.stream()
            .map(param -> encode(param.name()) + '=' + encode(param.value()))
            .collect(Collectors.joining("&"));
    }

    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Percent-encodes one path segment. Unlike form encoding a space becomes {@code %20}, since {@code +} is literal
     * in a path.
     */
    public static String encodePathSegment(String value) {
        return encode(value).replace("+", "%20");
    }

    static String basicAuth(String username, String password) {
        String credentials = username + ':' + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
