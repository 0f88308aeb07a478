package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.FormWriter;
import dev.twiliovoice.sdk.endpoints.RequestBody;

import java.util.List;
import java.util.Optional;

/**
 * Payload that changes a live participant: mute, hold, coach or play an announcement. Every field is optional.
 */
public final class UpdateParticipantBody implements RequestBody {

    private final Boolean muted;
    private final Boolean hold;
    private final String holdUrl;
    private final CallbackMethod holdMethod;
    private final String announceUrl;
    private final CallbackMethod announceMethod;
    private final String waitUrl;
    private final CallbackMethod waitMethod;
    private final Boolean beepOnExit;
    private final Boolean endConferenceOnExit;
    private final Boolean coaching;
    private final String callSidToCoach;

    private UpdateParticipantBody(Builder builder) {
        this.muted = builder.muted;
        this.hold = builder.hold;
        this.holdUrl = builder.holdUrl;
        this.holdMethod = builder.holdMethod;
        this.announceUrl = builder.announceUrl;
        this.announceMethod = builder.announceMethod;
        this.waitUrl = builder.waitUrl;
        this.waitMethod = builder.waitMethod;
        this.beepOnExit = builder.beepOnExit;
        this.endConferenceOnExit = builder.endConferenceOnExit;
        this.coaching = builder.coaching;
        this.callSidToCoach = builder.callSidToCoach;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static UpdateParticipantBody mute(boolean muted) {
        return builder().muted(muted).build();
    }

    public static UpdateParticipantBody hold(boolean hold) {
        return builder().hold(hold).build();
    }

    @Override
    public List<FormParam> params() {
        return new FormWriter()
            .optional("Muted", muted())
            .optional("Hold", hold())
            .optional("HoldUrl", holdUrl())
            .optional("HoldMethod", holdMethod())
            .optional("AnnounceUrl", announceUrl())
            .optional("AnnounceMethod", announceMethod())
            .optional("WaitUrl", waitUrl())
            .optional("WaitMethod", waitMethod())
            .optional("BeepOnExit", beepOnExit())
            .optional("EndConferenceOnExit", endConferenceOnExit())
            .optional("Coaching", coaching())
            .optional("CallSidToCoach", callSidToCoach())
            .build();
    }

    public Optional<Boolean> muted() {
        return Optional.ofNullable(muted);
    }

    public Optional<Boolean> hold() {
        return Optional.ofNullable(hold);
    }

    public Optional<String> holdUrl() {
        return Optional.ofNullable(holdUrl);
    }

    public Optional<CallbackMethod> holdMethod() {
        return Optional.ofNullable(holdMethod);
    }

    public Optional<String> announceUrl() {
        return Optional.ofNullable(announceUrl);
    }

    public Optional<CallbackMethod> announceMethod() {
        return Optional.ofNullable(announceMethod);
    }

    public Optional<String> waitUrl() {
        return Optional.ofNullable(waitUrl);
    }

    public Optional<CallbackMethod> waitMethod() {
        return Optional.ofNullable(waitMethod);
    }

    public Optional<Boolean> beepOnExit() {
        return Optional.ofNullable(beepOnExit);
    }

    public Optional<Boolean> endConferenceOnExit() {
        return Optional.ofNullable(endConferenceOnExit);
    }

    public Optional<Boolean> coaching() {
        return Optional.ofNullable(coaching);
    }

    public Optional<String> callSidToCoach() {
        return Optional.ofNullable(callSidToCoach);
    }

    public static final class Builder {
        private Boolean muted;
        private Boolean hold;
        private String holdUrl;
        private CallbackMethod holdMethod;
        private String announceUrl;
        private CallbackMethod announceMethod;
        private String waitUrl;
        private CallbackMethod waitMethod;
        private Boolean beepOnExit;
        private Boolean endConferenceOnExit;
        private Boolean coaching;
        private String callSidToCoach;

        private Builder() {
        }

        public Builder muted(boolean muted) {
            this.muted = muted;
            return this;
        }

        public Builder hold(boolean hold) {
            this.hold = hold;
            return this;
        }

        public Builder holdUrl(String holdUrl) {
            this.holdUrl = holdUrl;
            return this;
        }

        public Builder holdMethod(CallbackMethod holdMethod) {
            this.holdMethod = holdMethod;
            return this;
        }

        public Builder announceUrl(String announceUrl) {
            this.announceUrl = announceUrl;
            return this;
        }

        public Builder announceMethod(CallbackMethod announceMethod) {
            this.announceMethod = announceMethod;
            return this;
        }

        public Builder waitUrl(String waitUrl) {
            this.waitUrl = waitUrl;
            return this;
        }

        public Builder waitMethod(CallbackMethod waitMethod) {
            this.waitMethod = waitMethod;
            return this;
        }

        public Builder beepOnExit(boolean beepOnExit) {
            this.beepOnExit = beepOnExit;
            return this;
        }

        public Builder endConferenceOnExit(boolean endConferenceOnExit) {
            this.endConferenceOnExit = endConferenceOnExit;
            return this;
        }

        public Builder coaching(boolean coaching) {
            this.coaching = coaching;
            return this;
        }

        public Builder callSidToCoach(String callSidToCoach) {
            this.callSidToCoach = callSidToCoach;
            return this;
        }

        public UpdateParticipantBody build() {
            return new UpdateParticipantBody(this);
        }
    }
}
