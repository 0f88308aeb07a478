package dev.twiliovoice.sdk;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.builder()
            .accountSid("AC123")
            .authToken("token")
            .build();

        assertEquals(Config.DEFAULT_BASE_URL, config.getBaseUrl());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertNotNull(config.getHttpClient());
        assertTrue(config.getApiKey().isEmpty());
        assertTrue(config.getPhoneNumber().isEmpty());
        assertFalse(config.usesApiKey());
    }

    @Test
    void rejectsInvalidUrls() {
        Config.Builder builder = Config.builder()
            .accountSid("AC123")
            .authToken("token")
            .baseUrl("invalid");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void trimsTrailingSlashFromBaseUrl() {
        Config config = Config.builder()
            .accountSid("AC123")
            .authToken("token")
            .baseUrl("https://api.dublin.ie1.twilio.com/")
            .build();

        assertEquals("https://api.dublin.ie1.twilio.com", config.getBaseUrl());
    }

    @Test
    void rejectsBlankCredentials() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().accountSid(" ").authToken("token").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().accountSid("AC123").build());
    }

    @Test
    void nonPositiveTimeoutFallsBackToDefault() {
        Config config = Config.builder()
            .accountSid("AC123")
            .authToken("token")
            .httpTimeout(Duration.ZERO)
            .build();

        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
    }

    @Test
    void resolvesCredentialsFromEnvironment() throws Exception {
        Map<String, String> env = new HashMap<>();
        env.put(Config.ENV_ACCOUNT_SID, "AC123");
        env.put(Config.ENV_AUTH_TOKEN, " token ");
        env.put(Config.ENV_PHONE_NUMBER, "+15550002222");
        env.put(Config.ENV_API_KEY, "");

        Config config = Config.fromEnvironment(env);

        assertEquals("AC123", config.getAccountSid());
        assertEquals(" token ", config.getAuthToken());
        assertEquals("+15550002222", config.getPhoneNumber().orElseThrow());
        assertTrue(config.getApiKey().isEmpty());
        assertFalse(config.usesApiKey());
    }

    @Test
    void environmentCredentialsAreStoredVerbatim() throws Exception {
        Config config = Config.fromEnvironment(Map.of(
            Config.ENV_ACCOUNT_SID, " AC123",
            Config.ENV_AUTH_TOKEN, "tok "));

        assertEquals(" AC123", config.getAccountSid());
        assertEquals("tok ", config.getAuthToken());
    }

    @Test
    void apiKeyPairFromEnvironmentIsUsed() throws Exception {
        Config config = Config.fromEnvironment(Map.of(
            Config.ENV_ACCOUNT_SID, "AC123",
            Config.ENV_AUTH_TOKEN, "token",
            Config.ENV_API_KEY, "SK1",
            Config.ENV_API_KEY_SECRET, "key-secret"));

        assertTrue(config.usesApiKey());
        assertEquals("SK1", config.getApiKey().orElseThrow());
    }

    @Test
    void missingAccountSidIsReported() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> Config.fromEnvironment(Map.of(Config.ENV_AUTH_TOKEN, "token")));

        assertEquals(Config.ENV_ACCOUNT_SID, ex.getVariable());
        assertEquals("TWILIO_ACCOUNT_SID not set", ex.getMessage());
    }

    @Test
    void blankAuthTokenIsReported() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> Config.fromEnvironment(Map.of(Config.ENV_ACCOUNT_SID, "AC123", Config.ENV_AUTH_TOKEN, "  ")));

        assertEquals(Config.ENV_AUTH_TOKEN, ex.getVariable());
    }

    @Test
    void toStringOmitsSecrets() {
        Config config = Config.builder()
            .accountSid("AC123")
            .authToken("super-secret")
            .apiKey("SK1")
            .apiKeySecret("key-secret")
            .build();

        assertFalse(config.toString().contains("super-secret"));
        assertFalse(config.toString().contains("key-secret"));
    }
}
