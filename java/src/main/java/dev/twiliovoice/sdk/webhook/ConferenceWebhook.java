package dev.twiliovoice.sdk.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Conference status callback. Most fields are only present for some events, e.g. {@code recordingUrl} for
 * recording events or {@code callSidEndingConference} for {@link ConferenceEvent#CONFERENCE_END}.
 */
public record ConferenceWebhook(
    @JsonProperty("ConferenceSid") String conferenceSid,
    @JsonProperty("FriendlyName") String friendlyName,
    @JsonProperty("AccountSid") String accountSid,
    @JsonProperty("SequenceNumber") Integer sequenceNumber,
    @JsonProperty("Timestamp") String timestamp,
    @JsonProperty("StatusCallbackEvent") ConferenceEvent statusCallbackEvent,
    @JsonProperty("CallSid") String callSid,
    @JsonProperty("Muted") Boolean muted,
    @JsonProperty("Hold") Boolean hold,
    @JsonProperty("Coaching") Boolean coaching,
    @JsonProperty("EndConferenceOnExit") Boolean endConferenceOnExit,
    @JsonProperty("StartConferenceOnEnter") Boolean startConferenceOnEnter,
    @JsonProperty("CallSidEndingConference") String callSidEndingConference,
    @JsonProperty("ParticipantLabelEndingConference") String participantLabelEndingConference,
    @JsonProperty("Reason") String reason,
    @JsonProperty("ReasonAnnouncementFailed") String reasonAnnouncementFailed,
    @JsonProperty("AnnounceUrl") String announceUrl,
    @JsonProperty("ParticipantCallStatus") String participantCallStatus,
    @JsonProperty("EventName") String eventName,
    @JsonProperty("RecordingUrl") String recordingUrl,
    @JsonProperty("Duration") Integer duration,
    @JsonProperty("RecordingFileSize") Integer recordingFileSize
) {

    public boolean isConferenceEnd() {
        return statusCallbackEvent == ConferenceEvent.CONFERENCE_END;
    }
}
