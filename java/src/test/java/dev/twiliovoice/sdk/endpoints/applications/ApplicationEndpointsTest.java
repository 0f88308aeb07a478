package dev.twiliovoice.sdk.endpoints.applications;

import dev.twiliovoice.sdk.endpoints.ApiVersion;
import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.HttpMethod;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationEndpointsTest {

    @Test
    void createSendsOnlyConfiguredFields() {
        ApplicationBody body = ApplicationBody.builder()
            .friendlyName("IVR")
            .voiceUrl("https://example.com/voice")
            .voiceMethod(CallbackMethod.POST)
            .voiceCallerIdLookup(false)
            .build();

        CreateApplication endpoint = new CreateApplication("AC1", body);

        assertEquals(HttpMethod.POST, endpoint.method());
        assertEquals("/2010-04-01/Accounts/AC1/Applications.json", endpoint.path());
        assertEquals(List.of(
            new FormParam("FriendlyName", "IVR"),
            new FormParam("VoiceUrl", "https://example.com/voice"),
            new FormParam("VoiceMethod", "POST"),
            new FormParam("VoiceCallerIdLookup", "false")), endpoint.body().params());
    }

    @Test
    void deleteTargetsApplication() {
        DeleteApplication endpoint = new DeleteApplication("AC1", "AP1");

        assertEquals(HttpMethod.DELETE, endpoint.method());
        assertEquals("/2010-04-01/Accounts/AC1/Applications/AP1.json", endpoint.path());
        assertEquals(Void.class, endpoint.responseType());
    }

    @Test
    void listFiltersByFriendlyName() {
        ListApplications endpoint = new ListApplications("AC1", new ApplicationQuery().friendlyName("IVR").pageSize(5));

        assertEquals(List.of(new FormParam("FriendlyName", "IVR"), new FormParam("PageSize", "5")),
            endpoint.queryParams());
    }

    @Test
    void resourceDecodesSnakeCaseFields() throws Exception {
        String json = "{\"sid\":\"AP1\",\"account_sid\":\"AC1\",\"api_version\":\"2010-04-01\","
            + "\"voice_url\":\"https://example.com/voice\",\"voice_caller_id_lookup\":true,"
            + "\"public_application_connect_enabled\":false}";

        ApplicationResource resource = new FetchApplication("AC1", "AP1")
            .readResponse(json.getBytes(StandardCharsets.UTF_8));

        assertEquals("AP1", resource.sid());
        assertEquals(ApiVersion.V2010_04_01, resource.apiVersion());
        assertEquals("https://example.com/voice", resource.voiceUrl());
        assertTrue(resource.voiceCallerIdLookup());
        assertFalse(resource.publicApplicationConnectEnabled());
    }
}
