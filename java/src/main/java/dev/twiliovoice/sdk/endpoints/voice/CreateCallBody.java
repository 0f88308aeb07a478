package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.FormWriter;
import dev.twiliovoice.sdk.endpoints.RequestBody;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Payload of a create call request.
 *
 * <p>
 * {@code To}, {@code From} and one {@link CallSource} are always sent. Every other option is unset unless the
 * {@link Builder} was told otherwise, and unset options are left out of the request entirely: the API treats an
 * absent flag differently from an empty one.
 * </p>
 *
 * <p>
 * Phone numbers and URLs are passed through untouched; the API validates them and answers with an error when they are
 * malformed.
 * </p>
 */
public final class CreateCallBody implements RequestBody {

    private final String to;
    private final String from;
    private final CallSource source;
    private final CallbackMethod method;
    private final String fallbackUrl;
    private final CallbackMethod fallbackMethod;
    private final String statusCallback;
    private final CallbackMethod statusCallbackMethod;
    private final Set<CallEvent> statusCallbackEvents;
    private final String sendDigits;
    private final Integer timeout;
    private final Boolean record;
    private final String recordingChannels;
    private final String recordingStatusCallback;
    private final CallbackMethod recordingStatusCallbackMethod;
    private final Set<RecordingEvent> recordingStatusCallbackEvents;
    private final RecordingTrack recordingTrack;
    private final String sipAuthUsername;
    private final String sipAuthPassword;
    private final MachineDetection machineDetection;
    private final Integer machineDetectionTimeout;
    private final Integer machineDetectionSpeechThreshold;
    private final Integer machineDetectionSpeechEndThreshold;
    private final Integer machineDetectionSilenceTimeout;
    private final Boolean asyncAmd;
    private final String asyncAmdStatusCallback;
    private final CallbackMethod asyncAmdStatusCallbackMethod;
    private final Trim trim;
    private final String callerId;
    private final String byoc;
    private final String callReason;
    private final String callToken;
    private final Integer timeLimit;
    private final List<FormParam> extraParams;

    private CreateCallBody(Builder builder) {
        this.to = builder.to;
        this.from = builder.from;
        this.source = builder.source;
        this.method = builder.method;
        this.fallbackUrl = builder.fallbackUrl;
        this.fallbackMethod = builder.fallbackMethod;
        this.statusCallback = builder.statusCallback;
        this.statusCallbackMethod = builder.statusCallbackMethod;
        this.statusCallbackEvents = Collections.unmodifiableSet(EnumSet.copyOf(builder.statusCallbackEvents));
        this.sendDigits = builder.sendDigits;
        this.timeout = builder.timeout;
        this.record = builder.record;
        this.recordingChannels = builder.recordingChannels;
        this.recordingStatusCallback = builder.recordingStatusCallback;
        this.recordingStatusCallbackMethod = builder.recordingStatusCallbackMethod;
        this.recordingStatusCallbackEvents =
            Collections.unmodifiableSet(EnumSet.copyOf(builder.recordingStatusCallbackEvents));
        this.recordingTrack = builder.recordingTrack;
        this.sipAuthUsername = builder.sipAuthUsername;
        this.sipAuthPassword = builder.sipAuthPassword;
        this.machineDetection = builder.machineDetection;
        this.machineDetectionTimeout = builder.machineDetectionTimeout;
        this.machineDetectionSpeechThreshold = builder.machineDetectionSpeechThreshold;
        this.machineDetectionSpeechEndThreshold = builder.machineDetectionSpeechEndThreshold;
        this.machineDetectionSilenceTimeout = builder.machineDetectionSilenceTimeout;
        this.asyncAmd = builder.asyncAmd;
        this.asyncAmdStatusCallback = builder.asyncAmdStatusCallback;
        this.asyncAmdStatusCallbackMethod = builder.asyncAmdStatusCallbackMethod;
        this.trim = builder.trim;
        this.callerId = builder.callerId;
        this.byoc = builder.byoc;
        this.callReason = builder.callReason;
        this.callToken = builder.callToken;
        this.timeLimit = builder.timeLimit;
        this.extraParams = List.copyOf(builder.extraParams);
    }

    /**
     * Convenience constructor for the common case: call {@code to} from {@code from} and fetch instructions from
     * {@code url}. All optional fields stay unset.
     */
    public static CreateCallBody of(String to, String from, String url) {
        return builder(to, from, CallSource.url(url)).build();
    }

    public static Builder builder(String to, String from, CallSource source) {
        return new Builder(to, from, source);
    }

    @Override
    public List<FormParam> params() {
        return new FormWriter()
            .required("To", to)
            .required("From", from)
            .required(source.kind().param(), source.value())
            .optional("Method", method())
            .optional("FallbackUrl", fallbackUrl())
            .optional("FallbackMethod", fallbackMethod())
            .optional("StatusCallback", statusCallback())
            .optional("StatusCallbackMethod", statusCallbackMethod())
            .repeated("StatusCallbackEvent", statusCallbackEvents)
            .optional("SendDigits", sendDigits())
            .optional("Timeout", timeout())
            .optional("Record", record())
            .optional("RecordingChannels", recordingChannels())
            .optional("RecordingStatusCallback", recordingStatusCallback())
            .optional("RecordingStatusCallbackMethod", recordingStatusCallbackMethod())
            .repeated("RecordingStatusCallbackEvent", recordingStatusCallbackEvents)
            .optional("RecordingTrack", recordingTrack())
            .optional("SipAuthUsername", sipAuthUsername())
            .optional("SipAuthPassword", sipAuthPassword())
            .optional("MachineDetection", machineDetection())
            .optional("MachineDetectionTimeout", machineDetectionTimeout())
            .optional("MachineDetectionSpeechThreshold", machineDetectionSpeechThreshold())
            .optional("MachineDetectionSpeechEndThreshold", machineDetectionSpeechEndThreshold())
            .optional("MachineDetectionSilenceTimeout", machineDetectionSilenceTimeout())
            .optional("AsyncAmd", asyncAmd())
            .optional("AsyncAmdStatusCallback", asyncAmdStatusCallback())
            .optional("AsyncAmdStatusCallbackMethod", asyncAmdStatusCallbackMethod())
            .optional("Trim", trim())
            .optional("CallerId", callerId())
            .optional("Byoc", byoc())
            .optional("CallReason", callReason())
            .optional("CallToken", callToken())
            .optional("TimeLimit", timeLimit())
            .all(extraParams)
            .build();
    }

    public String to() {
        return to;
    }

    public String from() {
        return from;
    }

    public CallSource source() {
        return source;
    }

    public Optional<CallbackMethod> method() {
        return Optional.ofNullable(method);
    }

    public Optional<String> fallbackUrl() {
        return Optional.ofNullable(fallbackUrl);
    }

    public Optional<CallbackMethod> fallbackMethod() {
        return Optional.ofNullable(fallbackMethod);
    }

    public Optional<String> statusCallback() {
        return Optional.ofNullable(statusCallback);
    }

    public Optional<CallbackMethod> statusCallbackMethod() {
        return Optional.ofNullable(statusCallbackMethod);
    }

    /**
     * @return requested status callback events; empty when unset.
     */
    public Set<CallEvent> statusCallbackEvents() {
        return statusCallbackEvents;
    }

    public Optional<String> sendDigits() {
        return Optional.ofNullable(sendDigits);
    }

    public Optional<Integer> timeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Boolean> record() {
        return Optional.ofNullable(record);
    }

    public Optional<String> recordingChannels() {
        return Optional.ofNullable(recordingChannels);
    }

    public Optional<String> recordingStatusCallback() {
        return Optional.ofNullable(recordingStatusCallback);
    }

    public Optional<CallbackMethod> recordingStatusCallbackMethod() {
        return Optional.ofNullable(recordingStatusCallbackMethod);
    }

    public Set<RecordingEvent> recordingStatusCallbackEvents() {
        return recordingStatusCallbackEvents;
    }

    public Optional<RecordingTrack> recordingTrack() {
        return Optional.ofNullable(recordingTrack);
    }

    public Optional<String> sipAuthUsername() {
        return Optional.ofNullable(sipAuthUsername);
    }

    public Optional<String> sipAuthPassword() {
        return Optional.ofNullable(sipAuthPassword);
    }

    public Optional<MachineDetection> machineDetection() {
        return Optional.ofNullable(machineDetection);
    }

    public Optional<Integer> machineDetectionTimeout() {
        return Optional.ofNullable(machineDetectionTimeout);
    }

    public Optional<Integer> machineDetectionSpeechThreshold() {
        return Optional.ofNullable(machineDetectionSpeechThreshold);
    }

    public Optional<Integer> machineDetectionSpeechEndThreshold() {
        return Optional.ofNullable(machineDetectionSpeechEndThreshold);
    }

    public Optional<Integer> machineDetectionSilenceTimeout() {
        return Optional.ofNullable(machineDetectionSilenceTimeout);
    }

    public Optional<Boolean> asyncAmd() {
        return Optional.ofNullable(asyncAmd);
    }

    public Optional<String> asyncAmdStatusCallback() {
        return Optional.ofNullable(asyncAmdStatusCallback);
    }

    public Optional<CallbackMethod> asyncAmdStatusCallbackMethod() {
        return Optional.ofNullable(asyncAmdStatusCallbackMethod);
    }

    public Optional<Trim> trim() {
        return Optional.ofNullable(trim);
    }

    public Optional<String> callerId() {
        return Optional.ofNullable(callerId);
    }

    public Optional<String> byoc() {
        return Optional.ofNullable(byoc);
    }

    public Optional<String> callReason() {
        return Optional.ofNullable(callReason);
    }

    public Optional<String> callToken() {
        return Optional.ofNullable(callToken);
    }

    public Optional<Integer> timeLimit() {
        return Optional.ofNullable(timeLimit);
    }

    /**
     * @return options supplied through {@link Builder#parameter(String, String)}.
     */
    public List<FormParam> extraParams() {
        return extraParams;
    }

    /**
     * Mutable builder; every setter is optional and leaves the option unset when never called.
     */
    public static final class Builder {
        private final String to;
        private final String from;
        private final CallSource source;
        private CallbackMethod method;
        private String fallbackUrl;
        private CallbackMethod fallbackMethod;
        private String statusCallback;
        private CallbackMethod statusCallbackMethod;
        private final Set<CallEvent> statusCallbackEvents = EnumSet.noneOf(CallEvent.class);
        private String sendDigits;
        private Integer timeout;
        private Boolean record;
        private String recordingChannels;
        private String recordingStatusCallback;
        private CallbackMethod recordingStatusCallbackMethod;
        private final Set<RecordingEvent> recordingStatusCallbackEvents = EnumSet.noneOf(RecordingEvent.class);
        private RecordingTrack recordingTrack;
        private String sipAuthUsername;
        private String sipAuthPassword;
        private MachineDetection machineDetection;
        private Integer machineDetectionTimeout;
        private Integer machineDetectionSpeechThreshold;
        private Integer machineDetectionSpeechEndThreshold;
        private Integer machineDetectionSilenceTimeout;
        private Boolean asyncAmd;
        private String asyncAmdStatusCallback;
        private CallbackMethod asyncAmdStatusCallbackMethod;
        private Trim trim;
        private String callerId;
        private String byoc;
        private String callReason;
        private String callToken;
        private Integer timeLimit;
        private final List<FormParam> extraParams = new ArrayList<>();

        private Builder(String to, String from, CallSource source) {
            this.to = Objects.requireNonNull(to, "to");
            this.from = Objects.requireNonNull(from, "from");
            this.source = Objects.requireNonNull(source, "source");
        }

        /**
         * HTTP method Twilio uses to fetch the TwiML URL. Ignored by the API for inline TwiML.
         */
        public Builder method(CallbackMethod method) {
            this.method = method;
            return this;
        }

        public Builder fallbackUrl(String fallbackUrl) {
            this.fallbackUrl = fallbackUrl;
            return this;
        }

        public Builder fallbackMethod(CallbackMethod fallbackMethod) {
            this.fallbackMethod = fallbackMethod;
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

        /**
         * Adds call progress events to report to {@link #statusCallback(String)}. Each one is sent as its own
         * {@code StatusCallbackEvent} parameter.
         */
        public Builder statusCallbackEvent(CallEvent... events) {
            for (CallEvent event : events) {
                statusCallbackEvents.add(Objects.requireNonNull(event, "event"));
            }
            return this;
        }

        public Builder sendDigits(String sendDigits) {
            this.sendDigits = sendDigits;
            return this;
        }

        /**
         * Seconds to let the call ring before assuming no answer.
         */
        public Builder timeout(int timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder record(boolean record) {
            this.record = record;
            return this;
        }

        public Builder recordingChannels(String recordingChannels) {
            this.recordingChannels = recordingChannels;
            return this;
        }

        public Builder recordingStatusCallback(String recordingStatusCallback) {
            this.recordingStatusCallback = recordingStatusCallback;
            return this;
        }

        public Builder recordingStatusCallbackMethod(CallbackMethod recordingStatusCallbackMethod) {
            this.recordingStatusCallbackMethod = recordingStatusCallbackMethod;
            return this;
        }

        public Builder recordingStatusCallbackEvent(RecordingEvent... events) {
            for (RecordingEvent event : events) {
                recordingStatusCallbackEvents.add(Objects.requireNonNull(event, "event"));
            }
            return this;
        }

        public Builder recordingTrack(RecordingTrack recordingTrack) {
            this.recordingTrack = recordingTrack;
            return this;
        }

        public Builder sipAuthUsername(String sipAuthUsername) {
            this.sipAuthUsername = sipAuthUsername;
            return this;
        }

        public Builder sipAuthPassword(String sipAuthPassword) {
            this.sipAuthPassword = sipAuthPassword;
            return this;
        }

        public Builder machineDetection(MachineDetection machineDetection) {
            this.machineDetection = machineDetection;
            return this;
        }

        public Builder machineDetectionTimeout(int seconds) {
            this.machineDetectionTimeout = seconds;
            return this;
        }

        public Builder machineDetectionSpeechThreshold(int millis) {
            this.machineDetectionSpeechThreshold = millis;
            return this;
        }

        public Builder machineDetectionSpeechEndThreshold(int millis) {
            this.machineDetectionSpeechEndThreshold = millis;
            return this;
        }

        public Builder machineDetectionSilenceTimeout(int millis) {
            this.machineDetectionSilenceTimeout = millis;
            return this;
        }

        public Builder asyncAmd(boolean asyncAmd) {
            this.asyncAmd = asyncAmd;
            return this;
        }

        public Builder asyncAmdStatusCallback(String asyncAmdStatusCallback) {
            this.asyncAmdStatusCallback = asyncAmdStatusCallback;
            return this;
        }

        public Builder asyncAmdStatusCallbackMethod(CallbackMethod asyncAmdStatusCallbackMethod) {
            this.asyncAmdStatusCallbackMethod = asyncAmdStatusCallbackMethod;
            return this;
        }

        public Builder trim(Trim trim) {
            this.trim = trim;
            return this;
        }

        public Builder callerId(String callerId) {
            this.callerId = callerId;
            return this;
        }

        public Builder byoc(String byoc) {
            this.byoc = byoc;
            return this;
        }

        public Builder callReason(String callReason) {
            this.callReason = callReason;
            return this;
        }

        public Builder callToken(String callToken) {
            this.callToken = callToken;
            return this;
        }

        /**
         * Maximum call duration in seconds.
         */
        public Builder timeLimit(int timeLimit) {
            this.timeLimit = timeLimit;
            return this;
        }

        /**
         * Sends an option this type does not model yet. The name must be the API's own parameter name.
         */
        public Builder parameter(String name, String value) {
            extraParams.add(new FormParam(name, value));
            return this;
        }

        public CreateCallBody build() {
            return new CreateCallBody(this);
        }
    }
}
