package dev.twiliovoice.sdk;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.RequestBody;
import dev.twiliovoice.sdk.endpoints.voice.CallResource;
import dev.twiliovoice.sdk.endpoints.voice.CallSource;
import dev.twiliovoice.sdk.endpoints.voice.CreateCall;
import dev.twiliovoice.sdk.endpoints.voice.CreateCallBody;
import dev.twiliovoice.sdk.endpoints.voice.UpdateCall;
import dev.twiliovoice.sdk.endpoints.voice.UpdateCallBody;
import dev.twiliovoice.sdk.internal.ApiErrorDecoder;
import dev.twiliovoice.sdk.internal.HttpUtil;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for the Twilio voice REST API. The client is immutable and thread-safe: build one per process
 * (usually through {@link #fromEnvironment()}) and share it. Concurrent {@link #hit(Endpoint)} calls are independent
 * of each other.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Every API action is an {@link Endpoint} value; {@link #hit(Endpoint)} sends any of them and decodes the typed
 *       response.</li>
 *   <li>Requests authenticate with HTTP Basic using the account SID and auth token, or the API key pair when both
 *       halves are configured.</li>
 *   <li>Failures are never retried. Each one surfaces as a {@link TwilioException} subtype describing where it
 *       happened: {@link TransportException}, {@link TwilioApiException} or {@link DeserializationException}.</li>
 * </ul>
 */
public final class TwilioClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(TwilioClient.class.getName());

    private final Config config;
    private final HttpClient httpClient;

    /**
     * Constructs a new client using the supplied configuration.
     *
     * @param config caller-supplied configuration; defaults are already applied by {@link Config.Builder#build()}.
     */
    public TwilioClient(Config config) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = config.getHttpClient();
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[twilio-voice] client ready for account %s at %s", config.getAccountSid(), config.getBaseUrl()));
    }

    public TwilioClient(String accountSid, String authToken) {
        this(Config.builder().accountSid(accountSid).authToken(authToken).build());
    }

    /**
     * Builds a client from the process environment. See {@link Config#fromEnvironment(java.util.Map)} for the
     * variables read.
     *
     * @throws ConfigurationException when {@code TWILIO_ACCOUNT_SID} or {@code TWILIO_AUTH_TOKEN} is missing or blank.
     */
    public static TwilioClient fromEnvironment() throws ConfigurationException {
        return new TwilioClient(Config.fromEnvironment(System.getenv()));
    }

    public String accountSid() {
        return config.getAccountSid();
    }

    public String authToken() {
        return config.getAuthToken();
    }

    public String baseUrl() {
        return config.getBaseUrl();
    }

    /**
     * @return default caller number, when one was configured.
     */
    public Optional<String> phoneNumber() {
        return config.getPhoneNumber();
    }

    public Config config() {
        return config;
    }

    /**
     * @return a new client identical to this one apart from the default phone number.
     */
    public TwilioClient withPhoneNumber(String phoneNumber) {
        return new TwilioClient(config.withPhoneNumber(phoneNumber));
    }

    /**
     * @return a new client identical to this one apart from the API host.
     */
    public TwilioClient withBaseUrl(String baseUrl) {
        return new TwilioClient(config.withBaseUrl(baseUrl));
    }

    /**
     * Sends one API action and decodes its response.
     *
     * <p>
     * The calling thread blocks for a single round trip. Nothing is retried; interrupting the thread aborts the
     * request with a {@link TransportException} and restores the interrupt flag.
     * </p>
     *
     * @param endpoint action to perform.
     * @param <B>      request body type.
     * @param <R>      response type; {@code null} is returned for {@link Void} actions.
     * @return decoded response.
     * @throws TransportException       when no response could be obtained.
     * @throws TwilioApiException       when the API answered with a non-2xx status.
     * @throws DeserializationException when a 2xx body does not match {@code R}.
     */
    public <B extends RequestBody, R> R hit(Endpoint<B, R> endpoint) throws TwilioException {
        Objects.requireNonNull(endpoint, "endpoint");
        URI uri = endpoint.uri(config.getBaseUrl());
        String method = endpoint.method().name();
        String action = endpoint.getClass().getSimpleName();
        LOGGER.fine(() -> String.format(Locale.ROOT, "[twilio-voice] %s %s %s", action, method, uri.getPath()));

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendForm(httpClient, method, uri, endpoint.body().params(),
                username(), password(), config.getHttpTimeout());
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new TransportException(action + " interrupted", ex);
            }
            throw new TransportException(action + " request: " + ex.getMessage(), ex);
        }

        byte[] body;
        try (InputStream bodyStream = response.body()) {
            body = bodyStream == null ? new byte[0] : bodyStream.readAllBytes();
        } catch (IOException ex) {
            throw new TransportException(action + " read response: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            TwilioApiException error = ApiErrorDecoder.decode(status, body);
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[twilio-voice] %s failed with status %d (code %s): %s",
                action, status, error.getCode(), error.getMessage()));
            throw error;
        }

        try {
            R result = endpoint.readResponse(body);
            if (result == null && endpoint.responseType() != Void.class) {
                throw new DeserializationException("decode " + action + " response: empty body", null);
            }
            return result;
        } catch (IOException ex) {
            throw new DeserializationException("decode " + action + " response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Places a call whose instructions are fetched from {@code url}.
     */
    public CallResource createCallWithUrl(String to, String from, String url) throws TwilioException {
        return hit(new CreateCall(accountSid(), CreateCallBody.of(to, from, url)));
    }

    /**
     * Places a call driven by inline TwiML.
     */
    public CallResource createCallWithTwiml(String to, String from, String twiml) throws TwilioException {
        return hit(new CreateCall(accountSid(), CreateCallBody.builder(to, from, CallSource.twiml(twiml)).build()));
    }

    /**
     * Redirects a live call to instructions fetched from {@code url}.
     */
    public CallResource updateCallWithUrl(String callSid, String url) throws TwilioException {
        return hit(new UpdateCall(accountSid(), callSid, UpdateCallBody.redirect(url)));
    }

    /**
     * Replaces the instructions of a live call with inline TwiML.
     */
    public CallResource updateCallWithTwiml(String callSid, String twiml) throws TwilioException {
        return hit(new UpdateCall(accountSid(), callSid, UpdateCallBody.twiml(twiml)));
    }

    /**
     * Closes the client. Currently a no-op because the underlying {@link HttpClient} does not require explicit
     * shutdown on JDK 17.
     */
    @Override
    public void close() {
        // httpClient is shared with the caller's config; nothing to release.
    }

    private String username() {
        return config.usesApiKey() ? config.getApiKey().orElseThrow() : config.getAccountSid();
    }

    private String password() {
        return config.usesApiKey() ? config.getApiKeySecret().orElseThrow() : config.getAuthToken();
    }

    @Override
    public String toString() {
        return "TwilioClient{" + config + '}';
    }
}
