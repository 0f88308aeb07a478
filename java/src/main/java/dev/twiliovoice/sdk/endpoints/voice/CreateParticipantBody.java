package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.FormWriter;
import dev.twiliovoice.sdk.endpoints.RequestBody;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Payload that dials a new participant into a conference. {@code From} and {@code To} are always sent; everything
 * else only when set.
 */
public final class CreateParticipantBody implements RequestBody {

    private final String from;
    private final String to;
    private final String label;
    private final String statusCallback;
    private final CallbackMethod statusCallbackMethod;
    private final Set<CallEvent> statusCallbackEvents;
    private final Integer timeout;
    private final Boolean record;
    private final Boolean muted;
    private final String beep;
    private final Boolean startConferenceOnEnter;
    private final Boolean endConferenceOnExit;
    private final String waitUrl;
    private final CallbackMethod waitMethod;
    private final Boolean earlyMedia;
    private final Integer maxParticipants;
    private final String conferenceRecord;
    private final String conferenceTrim;
    private final String conferenceStatusCallback;
    private final CallbackMethod conferenceStatusCallbackMethod;
    private final Set<ConferenceEventFilter> conferenceStatusCallbackEvents;
    private final String region;
    private final String callerId;
    private final Integer timeLimit;
    private final MachineDetection machineDetection;
    private final Boolean coaching;
    private final String callSidToCoach;
    private final String callReason;

    private CreateParticipantBody(Builder builder) {
        this.from = builder.from;
        this.to = builder.to;
        this.label = builder.label;
        this.statusCallback = builder.statusCallback;
        this.statusCallbackMethod = builder.statusCallbackMethod;
        this.statusCallbackEvents = Collections.unmodifiableSet(EnumSet.copyOf(builder.statusCallbackEvents));
        this.timeout = builder.timeout;
        this.record = builder.record;
        this.muted = builder.muted;
        this.beep = builder.beep;
        this.startConferenceOnEnter = builder.startConferenceOnEnter;
        this.endConferenceOnExit = builder.endConferenceOnExit;
        this.waitUrl = builder.waitUrl;
        this.waitMethod = builder.waitMethod;
        this.earlyMedia = builder.earlyMedia;
        this.maxParticipants = builder.maxParticipants;
        this.conferenceRecord = builder.conferenceRecord;
        this.conferenceTrim = builder.conferenceTrim;
        this.conferenceStatusCallback = builder.conferenceStatusCallback;
        this.conferenceStatusCallbackMethod = builder.conferenceStatusCallbackMethod;
        this.conferenceStatusCallbackEvents =
            Collections.unmodifiableSet(EnumSet.copyOf(builder.conferenceStatusCallbackEvents));
        this.region = builder.region;
        this.callerId = builder.callerId;
        this.timeLimit = builder.timeLimit;
        this.machineDetection = builder.machineDetection;
        this.coaching = builder.coaching;
        this.callSidToCoach = builder.callSidToCoach;
        this.callReason = builder.callReason;
    }

    public static CreateParticipantBody of(String from, String to) {
        return builder(from, to).build();
    }

    public static Builder builder(String from, String to) {
        return new Builder(from, to);
    }

    @Override
    public List<FormParam> params() {
        return new FormWriter()
            .required("From", from)
            .required("To", to)
            .optional("Label", label())
            .optional("StatusCallback", statusCallback())
            .optional("StatusCallbackMethod", statusCallbackMethod())
            .repeated("StatusCallbackEvent", statusCallbackEvents)
            .optional("Timeout", timeout())
            .optional("Record", record())
            .optional("Muted", muted())
            .optional("Beep", beep())
            .optional("StartConferenceOnEnter", startConferenceOnEnter())
            .optional("EndConferenceOnExit", endConferenceOnExit())
            .optional("WaitUrl", waitUrl())
            .optional("WaitMethod", waitMethod())
            .optional("EarlyMedia", earlyMedia())
            .optional("MaxParticipants", maxParticipants())
            .optional("ConferenceRecord", conferenceRecord())
            .optional("ConferenceTrim", conferenceTrim())
            .optional("ConferenceStatusCallback", conferenceStatusCallback())
            .optional("ConferenceStatusCallbackMethod", conferenceStatusCallbackMethod())
            .repeated("ConferenceStatusCallbackEvent", conferenceStatusCallbackEvents)
            .optional("Region", region())
            .optional("CallerId", callerId())
            .optional("TimeLimit", timeLimit())
            .optional("MachineDetection", machineDetection())
            .optional("Coaching", coaching())
            .optional("CallSidToCoach", callSidToCoach())
            .optional("CallReason", callReason())
            .build();
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public Optional<String> statusCallback() {
        return Optional.ofNullable(statusCallback);
    }

    public Optional<CallbackMethod> statusCallbackMethod() {
        return Optional.ofNullable(statusCallbackMethod);
    }

    public Set<CallEvent> statusCallbackEvents() {
        return statusCallbackEvents;
    }

    public Optional<Integer> timeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Boolean> record() {
        return Optional.ofNullable(record);
    }

    public Optional<Boolean> muted() {
        return Optional.ofNullable(muted);
    }

    public Optional<String> beep() {
        return Optional.ofNullable(beep);
    }

    public Optional<Boolean> startConferenceOnEnter() {
        return Optional.ofNullable(startConferenceOnEnter);
    }

    public Optional<Boolean> endConferenceOnExit() {
        return Optional.ofNullable(endConferenceOnExit);
    }

    public Optional<String> waitUrl() {
        return Optional.ofNullable(waitUrl);
    }

    public Optional<CallbackMethod> waitMethod() {
        return Optional.ofNullable(waitMethod);
    }

    public Optional<Boolean> earlyMedia() {
        return Optional.ofNullable(earlyMedia);
    }

    public Optional<Integer> maxParticipants() {
        return Optional.ofNullable(maxParticipants);
    }

    public Optional<String> conferenceRecord() {
        return Optional.ofNullable(conferenceRecord);
    }

    public Optional<String> conferenceTrim() {
        return Optional.ofNullable(conferenceTrim);
    }

    public Optional<String> conferenceStatusCallback() {
        return Optional.ofNullable(conferenceStatusCallback);
    }

    public Optional<CallbackMethod> conferenceStatusCallbackMethod() {
        return Optional.ofNullable(conferenceStatusCallbackMethod);
    }

    public Set<ConferenceEventFilter> conferenceStatusCallbackEvents() {
        return conferenceStatusCallbackEvents;
    }

    public Optional<String> region() {
        return Optional.ofNullable(region);
    }

    public Optional<String> callerId() {
        return Optional.ofNullable(callerId);
    }

    public Optional<Integer> timeLimit() {
        return Optional.ofNullable(timeLimit);
    }

    public Optional<MachineDetection> machineDetection() {
        return Optional.ofNullable(machineDetection);
    }

    public Optional<Boolean> coaching() {
        return Optional.ofNullable(coaching);
    }

    public Optional<String> callSidToCoach() {
        return Optional.ofNullable(callSidToCoach);
    }

    public Optional<String> callReason() {
        return Optional.ofNullable(callReason);
    }

    public static final class Builder {
        private final String from;
        private final String to;
        private String label;
        private String statusCallback;
        private CallbackMethod statusCallbackMethod;
        private final Set<CallEvent> statusCallbackEvents = EnumSet.noneOf(CallEvent.class);
        private Integer timeout;
        private Boolean record;
        private Boolean muted;
        private String beep;
        private Boolean startConferenceOnEnter;
        private Boolean endConferenceOnExit;
        private String waitUrl;
        private CallbackMethod waitMethod;
        private Boolean earlyMedia;
        private Integer maxParticipants;
        private String conferenceRecord;
        private String conferenceTrim;
        private String conferenceStatusCallback;
        private CallbackMethod conferenceStatusCallbackMethod;
        private final Set<ConferenceEventFilter> conferenceStatusCallbackEvents =
            EnumSet.noneOf(ConferenceEventFilter.class);
        private String region;
        private String callerId;
        private Integer timeLimit;
        private MachineDetection machineDetection;
        private Boolean coaching;
        private String callSidToCoach;
        private String callReason;

        private Builder(String from, String to) {
            this.from = Objects.requireNonNull(from, "From");
            this.to = Objects.requireNonNull(to, "To");
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder statusCallback(String statusCallback) {
            this.statusCallback = statusCallback;
            return this;
        }

        public Builder statusCallbackMethod(CallbackMethod statusCallbackMethod) {
            this.statusCallbackMethod = statusCallbackMethod;
            return this;
        }

        public Builder statusCallbackEvent(CallEvent... events) {
            for (CallEvent event : events) {
                statusCallbackEvents.add(Objects.requireNonNull(event, "event"));
            }
            return this;
        }

        public Builder timeout(int timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder record(boolean record) {
            this.record = record;
            return this;
        }

        public Builder muted(boolean muted) {
            this.muted = muted;
            return this;
        }

        /**
         * @param beep {@code true}, {@code false}, {@code onEnter} or {@code onExit}.
         */
        public Builder beep(String beep) {
            this.beep = beep;
            return this;
        }

        public Builder startConferenceOnEnter(boolean startConferenceOnEnter) {
            this.startConferenceOnEnter = startConferenceOnEnter;
            return this;
        }

        public Builder endConferenceOnExit(boolean endConferenceOnExit) {
            this.endConferenceOnExit = endConferenceOnExit;
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

        public Builder earlyMedia(boolean earlyMedia) {
            this.earlyMedia = earlyMedia;
            return this;
        }

        public Builder maxParticipants(int maxParticipants) {
            this.maxParticipants = maxParticipants;
            return this;
        }

        public Builder conferenceRecord(String conferenceRecord) {
            this.conferenceRecord = conferenceRecord;
            return this;
        }

        public Builder conferenceTrim(String conferenceTrim) {
            this.conferenceTrim = conferenceTrim;
            return this;
        }

        public Builder conferenceStatusCallback(String conferenceStatusCallback) {
            this.conferenceStatusCallback = conferenceStatusCallback;
            return this;
        }

        public Builder conferenceStatusCallbackMethod(CallbackMethod conferenceStatusCallbackMethod) {
            this.conferenceStatusCallbackMethod = conferenceStatusCallbackMethod;
            return this;
        }

        public Builder conferenceStatusCallbackEvent(ConferenceEventFilter... events) {
            for (ConferenceEventFilter event : events) {
                conferenceStatusCallbackEvents.add(Objects.requireNonNull(event, "event"));
            }
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder callerId(String callerId) {
            this.callerId = callerId;
            return this;
        }

        public Builder timeLimit(int timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        public Builder machineDetection(MachineDetection machineDetection) {
            this.machineDetection = machineDetection;
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

        public Builder callReason(String callReason) {
            this.callReason = callReason;
            return this;
        }

        public CreateParticipantBody build() {
            return new CreateParticipantBody(this);
        }
    }
}
