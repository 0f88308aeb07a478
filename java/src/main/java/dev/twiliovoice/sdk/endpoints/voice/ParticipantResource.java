package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A call connected to a conference. Participants are addressed by the SID of their call.
 */
public record ParticipantResource(
    @JsonProperty("account_sid") String accountSid,
    @JsonProperty("call_sid") String callSid,
    String label,
    @JsonProperty("call_sid_to_coach") String callSidToCoach,
    Boolean coaching,
    @JsonProperty("conference_sid") String conferenceSid,
    @JsonProperty("date_created") String dateCreated,
    @JsonProperty("date_updated") String dateUpdated,
    @JsonProperty("end_conference_on_exit") Boolean endConferenceOnExit,
    Boolean muted,
    Boolean hold,
    @JsonProperty("start_conference_on_enter") Boolean startConferenceOnEnter,
    ParticipantStatus status,
    @JsonProperty("queue_time") String queueTime,
    String uri
) {
}
