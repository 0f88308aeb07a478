package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answering machine detection verdicts.
 */
public enum AnsweredBy {
    @JsonProperty("human")
    HUMAN,
    @JsonProperty("machine")
    MACHINE,
    @JsonProperty("machine_start")
    MACHINE_START,
    @JsonProperty("machine_end_beep")
    MACHINE_END_BEEP,
    @JsonProperty("machine_end_silence")
    MACHINE_END_SILENCE,
    @JsonProperty("machine_end_other")
    MACHINE_END_OTHER,
    @JsonProperty("fax")
    FAX,
    @JsonProperty("unknown")
    UNKNOWN;

    public boolean isMachine() {
        return this == MACHINE || name().startsWith("MACHINE_");
    }
}
