package dev.twiliovoice.sdk.webhook;

import dev.twiliovoice.sdk.DeserializationException;
import dev.twiliovoice.sdk.endpoints.ApiVersion;
import dev.twiliovoice.sdk.endpoints.voice.AnsweredBy;
import dev.twiliovoice.sdk.endpoints.voice.CallStatus;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookRequestsTest {

    @Test
    void callWebhookKeepsUnknownParameters() throws Exception {
        Map<String, String> params = callParams();
        params.put("CallerName", "Jane");
        params.put("Digits", "42");

        CallWebhook webhook = WebhookRequests.call(params);

        assertEquals("CA1", webhook.callSid());
        assertEquals(CallStatus.RINGING, webhook.callStatus());
        assertEquals(ApiVersion.V2010_04_01, webhook.apiVersion());
        assertEquals("Jane", webhook.callerName().orElseThrow());
        assertTrue(webhook.fromCity().isEmpty());
        assertEquals(Map.of("Digits", "42"), webhook.extra());
        assertEquals("42", webhook.extra("Digits").orElseThrow());
        assertFalse(webhook.isNoAnswer());
    }

    @Test
    void noAnswerIsDetected() throws Exception {
        Map<String, String> params = callParams();
        params.put("CallStatus", "no-answer");

        assertTrue(WebhookRequests.call(params).isNoAnswer());
    }

    @Test
    void missingRequiredParameterIsRejected() {
        Map<String, String> params = callParams();
        params.remove("CallSid");

        DeserializationException ex = assertThrows(DeserializationException.class, () -> WebhookRequests.call(params));
        assertTrue(ex.getMessage().contains("CallSid"));
    }

    @Test
    void unknownStatusIsRejected() {
        Map<String, String> params = callParams();
        params.put("CallStatus", "teleported");

        assertThrows(DeserializationException.class, () -> WebhookRequests.call(params));
    }

    @Test
    void conferenceEndIsRecognised() throws Exception {
        Map<String, String> params = new HashMap<>();
        params.put("ConferenceSid", "CF1");
        params.put("FriendlyName", "standup");
        params.put("AccountSid", "AC1");
        params.put("SequenceNumber", "7");
        params.put("Timestamp", "Tue, 31 Aug 2010 20:36:28 +0000");
        params.put("StatusCallbackEvent", "conference-end");
        params.put("CallSidEndingConference", "CA9");
        params.put("EndConferenceOnExit", "true");

        ConferenceWebhook webhook = WebhookRequests.conference(params);

        assertTrue(webhook.isConferenceEnd());
        assertEquals(7, webhook.sequenceNumber());
        assertEquals(Boolean.TRUE, webhook.endConferenceOnExit());
        assertEquals("CA9", webhook.callSidEndingConference());
    }

    @Test
    void participantEventIsNotConferenceEnd() throws Exception {
        Map<String, String> params = new HashMap<>();
        params.put("ConferenceSid", "CF1");
        params.put("FriendlyName", "standup");
        params.put("AccountSid", "AC1");
        params.put("SequenceNumber", "2");
        params.put("Timestamp", "Tue, 31 Aug 2010 20:36:28 +0000");
        params.put("StatusCallbackEvent", "participant-join");

        ConferenceWebhook webhook = WebhookRequests.conference(params);

        assertEquals(ConferenceEvent.PARTICIPANT_JOIN, webhook.statusCallbackEvent());
        assertFalse(webhook.isConferenceEnd());
    }

    @Test
    void amdResultIsDecoded() throws Exception {
        AmdWebhook webhook = WebhookRequests.amd(Map.of(
            "CallSid", "CA1",
            "AccountSid", "AC1",
            "AnsweredBy", "machine_end_beep",
            "MachineDetectionDuration", "2300"));

        assertEquals(AnsweredBy.MACHINE_END_BEEP, webhook.answeredBy());
        assertTrue(webhook.answeredBy().isMachine());
        assertEquals(2300, webhook.machineDetectionDuration());
    }

    @Test
    void formBodyIsDecoded() {
        Map<String, String> params =
            WebhookRequests.parseForm("CallSid=CA1&From=%2B15550002222&Flag&SpeechResult=hello+there");

        assertEquals("CA1", params.get("CallSid"));
        assertEquals("+15550002222", params.get("From"));
        assertEquals("", params.get("Flag"));
        assertEquals("hello there", params.get("SpeechResult"));
        assertTrue(WebhookRequests.parseForm("").isEmpty());
    }

    private static Map<String, String> callParams() {
        Map<String, String> params = new HashMap<>();
        params.put("CallSid", "CA1");
        params.put("AccountSid", "AC1");
        params.put("From", "+15550002222");
        params.put("To", "+15550001111");
        params.put("CallStatus", "ringing");
        params.put("ApiVersion", "2010-04-01");
        params.put("Direction", "inbound");
        return params;
    }
}
