package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CreateCallBodyTest {

    @Test
    void minimalBodySendsOnlyRequiredFields() {
        CreateCallBody body = CreateCallBody.of("+15550001111", "+15550002222", "https://example.com/twiml");

        assertEquals(List.of(
            new FormParam("To", "+15550001111"),
            new FormParam("From", "+15550002222"),
            new FormParam("Url", "https://example.com/twiml")), body.params());
        assertTrue(body.timeout().isEmpty());
        assertTrue(body.statusCallbackEvents().isEmpty());
    }

    @Test
    void setOptionsAreSentAndOthersLeftOut() {
        CreateCallBody body = CreateCallBody.builder("+15550001111", "+15550002222",
                CallSource.url("https://example.com/twiml"))
            .method(CallbackMethod.GET)
            .timeout(15)
            .record(true)
            .machineDetection(MachineDetection.DETECT_MESSAGE_END)
            .asyncAmd(true)
            .trim(Trim.DO_NOT_TRIM)
            .build();

        assertEquals(Set.of("To", "From", "Url", "Method", "Timeout", "Record", "MachineDetection", "AsyncAmd", "Trim"),
            names(body));
        Map<String, String> values = values(body);
        assertEquals("GET", values.get("Method"));
        assertEquals("15", values.get("Timeout"));
        assertEquals("true", values.get("Record"));
        assertEquals("DetectMessageEnd", values.get("MachineDetection"));
        assertEquals("do-not-trim", values.get("Trim"));
    }

    @Test
    void falseBooleansAreStillSent() {
        CreateCallBody body = CreateCallBody.builder("+1", "+2", CallSource.url("https://example.com"))
            .record(false)
            .build();

        assertEquals("false", values(body).get("Record"));
    }

    @Test
    void callbackEventsAreRepeatedParameters() {
        CreateCallBody body = CreateCallBody.builder("+1", "+2", CallSource.url("https://example.com"))
            .statusCallback("https://example.com/status")
            .statusCallbackEvent(CallEvent.ANSWERED, CallEvent.INITIATED, CallEvent.ANSWERED)
            .recordingStatusCallbackEvent(RecordingEvent.COMPLETED)
            .build();

        List<String> events = body.params().stream()
            .filter(param -> param.name().equals("StatusCallbackEvent"))
            .map(FormParam::value)
            .collect(Collectors.toList());
        assertEquals(List.of("initiated", "answered"), events);
        assertEquals("completed", values(body).get("RecordingStatusCallbackEvent"));
    }

    @Test
    void twimlAndApplicationSourcesReplaceUrl() {
        CreateCallBody twiml = CreateCallBody.builder("+1", "+2", CallSource.twiml("<Response/>")).build();
        CreateCallBody app = CreateCallBody.builder("+1", "+2", CallSource.applicationSid("AP1")).build();

        assertEquals(Set.of("To", "From", "Twiml"), names(twiml));
        assertEquals(Set.of("To", "From", "ApplicationSid"), names(app));
        assertEquals(CallSource.Kind.APPLICATION_SID, app.source().kind());
    }

    @Test
    void extraParametersAreAppended() {
        CreateCallBody body = CreateCallBody.builder("+1", "+2", CallSource.url("https://example.com"))
            .parameter("CallerName", "Support")
            .build();

        List<FormParam> params = body.params();
        assertEquals(new FormParam("CallerName", "Support"), params.get(params.size() - 1));
    }

    @Test
    void requiredFieldsCannotBeNull() {
        assertThrows(NullPointerException.class, () -> CreateCallBody.of(null, "+2", "https://example.com"));
        assertThrows(NullPointerException.class, () -> CreateCallBody.of("+1", "+2", null));
    }

    private static Set<String> names(CreateCallBody body) {
        return body.params().stream().map(FormParam::name).collect(Collectors.toSet());
    }

    private static Map<String, String> values(CreateCallBody body) {
        return body.params().stream().collect(Collectors.toMap(FormParam::name, FormParam::value, (a, b) -> a));
    }
}
