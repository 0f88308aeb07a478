package dev.twiliovoice.sdk.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Value of {@code StatusCallbackEvent} in conference status callbacks.
 */
public enum ConferenceEvent {
    @JsonProperty("conference-end")
    CONFERENCE_END,
    @JsonProperty("conference-start")
    CONFERENCE_START,
    @JsonProperty("participant-leave")
    PARTICIPANT_LEAVE,
    @JsonProperty("participant-join")
    PARTICIPANT_JOIN,
    @JsonProperty("participant-mute")
    PARTICIPANT_MUTE,
    @JsonProperty("participant-unmute")
    PARTICIPANT_UNMUTE,
    @JsonProperty("participant-hold")
    PARTICIPANT_HOLD,
    @JsonProperty("participant-unhold")
    PARTICIPANT_UNHOLD,
    @JsonProperty("participant-modify")
    PARTICIPANT_MODIFY,
    @JsonProperty("participant-speech-start")
    PARTICIPANT_SPEECH_START,
    @JsonProperty("participant-speech-stop")
    PARTICIPANT_SPEECH_STOP,
    @JsonProperty("announcement-end")
    ANNOUNCEMENT_END,
    @JsonProperty("announcement-fail")
    ANNOUNCEMENT_FAIL
}
