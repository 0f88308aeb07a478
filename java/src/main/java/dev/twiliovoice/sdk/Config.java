package dev.twiliovoice.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link TwilioClient} instances.
 */
public final class Config {

    public static final String DEFAULT_BASE_URL = "https://api.twilio.com";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    public static final String ENV_ACCOUNT_SID = "TWILIO_ACCOUNT_SID";
    public static final String ENV_AUTH_TOKEN = "TWILIO_AUTH_TOKEN";
    public static final String ENV_API_KEY = "TWILIO_MAIN_API_KEY";
    public static final String ENV_API_KEY_SECRET = "TWILIO_MAIN_API_KEY_SECRET";
    public static final String ENV_PHONE_NUMBER = "TWILIO_PHONE_NUMBER";

    private final String accountSid;
    private final String authToken;
    private final String baseUrl;
    private final String apiKey;
    private final String apiKeySecret;
    private final String phoneNumber;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private Config(Builder builder) {
        this.accountSid = builder.accountSid;
        this.authToken = builder.authToken;
        this.baseUrl = builder.baseUrl;
        this.apiKey = builder.apiKey;
        this.apiKeySecret = builder.apiKeySecret;
        this.phoneNumber = builder.phoneNumber;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves configuration from environment variables.
     *
     * <p>
     * {@value #ENV_ACCOUNT_SID} and {@value #ENV_AUTH_TOKEN} are mandatory and stored exactly as set.
     * {@value #ENV_API_KEY}, {@value #ENV_API_KEY_SECRET} and {@value #ENV_PHONE_NUMBER} are picked up when present.
     * </p>
     *
     * @param env variable lookup, typically {@link System#getenv()}.
     * @return configuration with defaults applied.
     * @throws ConfigurationException when a mandatory variable is missing or blank.
     */
    public static Config fromEnvironment(Map<String, String> env) throws ConfigurationException {
        Objects.requireNonNull(env, "env");
        String accountSid = env.get(ENV_ACCOUNT_SID);
        if (trimToNull(accountSid) == null) {
            throw new ConfigurationException(ENV_ACCOUNT_SID);
        }
        String authToken = env.get(ENV_AUTH_TOKEN);
        if (trimToNull(authToken) == null) {
            throw new ConfigurationException(ENV_AUTH_TOKEN);
        }
        return builder()
            .accountSid(accountSid)
            .authToken(authToken)
            .apiKey(trimToNull(env.get(ENV_API_KEY)))
            .apiKeySecret(trimToNull(env.get(ENV_API_KEY_SECRET)))
            .phoneNumber(trimToNull(env.get(ENV_PHONE_NUMBER)))
            .build();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(DEFAULT_BASE_URL));

        if (accountSid == null || accountSid.isBlank()) {
            throw new IllegalArgumentException("AccountSid is required");
        }
        if (authToken == null || authToken.isBlank()) {
            throw new IllegalArgumentException("AuthToken is required");
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .accountSid(accountSid)
            .authToken(authToken)
            .baseUrl(resolvedBaseUrl)
            .apiKey(trimToNull(apiKey))
            .apiKeySecret(trimToNull(apiKeySecret))
            .phoneNumber(trimToNull(phoneNumber))
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .buildInternal();
    }

    /**
     * Returns a copy of this configuration with a different default phone number.
     */
    public Config withPhoneNumber(String phoneNumber) {
        return toBuilder().phoneNumber(phoneNumber).build();
    }

    /**
     * Returns a copy of this configuration pointed at a different API host, for example a regional edge or a local
     * stub during tests.
     */
    public Config withBaseUrl(String baseUrl) {
        return toBuilder().baseUrl(baseUrl).build();
    }

    private Builder toBuilder() {
        return new Builder()
            .accountSid(accountSid)
            .authToken(authToken)
            .baseUrl(baseUrl)
            .apiKey(apiKey)
            .apiKeySecret(apiKeySecret)
            .phoneNumber(phoneNumber)
            .httpClient(httpClient)
            .httpTimeout(httpTimeout);
    }

    static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getAccountSid() {
        return accountSid;
    }

    public String getAuthToken() {
        return authToken;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Optional<String> getApiKey() {
        return Optional.ofNullable(apiKey);
    }

    public Optional<String> getApiKeySecret() {
        return Optional.ofNullable(apiKeySecret);
    }

    public Optional<String> getPhoneNumber() {
        return Optional.ofNullable(phoneNumber);
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    /**
     * @return {@code true} when both halves of an API key pair are configured, in which case requests authenticate
     * with the key instead of the account auth token.
     */
    public boolean usesApiKey() {
        return apiKey != null && apiKeySecret != null;
    }

    @Override
    public String toString() {
        return "Config{accountSid=" + accountSid + ", baseUrl=" + baseUrl + ", apiKey=" + apiKey
            + ", phoneNumber=" + phoneNumber + ", httpTimeout=" + httpTimeout + '}';
    }

    public static final class Builder {
        private String accountSid;
        private String authToken;
        private String baseUrl;
        private String apiKey;
        private String apiKeySecret;
        private String phoneNumber;
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder accountSid(String accountSid) {
            this.accountSid = accountSid;
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiKeySecret(String apiKeySecret) {
            this.apiKeySecret = apiKeySecret;
            return this;
        }

        public Builder phoneNumber(String phoneNumber) {
            this.phoneNumber = phoneNumber;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
