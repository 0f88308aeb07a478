package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.FormWriter;
import dev.twiliovoice.sdk.endpoints.RequestBody;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload that forks the audio of a live call to a WebSocket. Custom parameters are delivered to the socket in the
 * {@code start} message and are sent as numbered {@code ParameterN.Name}/{@code ParameterN.Value} pairs.
 */
public final class CreateStreamBody implements RequestBody {

    /** Upper bound the API accepts for custom parameters. */
    public static final int MAX_PARAMETERS = 99;

    private final String url;
    private final String name;
    private final StreamTrack track;
    private final String statusCallback;
    private final CallbackMethod statusCallbackMethod;
    private final Map<String, String> parameters;

    private CreateStreamBody(Builder builder) {
        this.url = builder.url;
        this.name = builder.name;
        this.track = builder.track;
        this.statusCallback = builder.statusCallback;
        this.statusCallbackMethod = builder.statusCallbackMethod;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    }

    public static CreateStreamBody of(String url) {
        return builder(url).build();
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    @Override
    public List<FormParam> params() {
        FormWriter writer = new FormWriter()
            .required("Url", url)
            .optional("Name", name())
            .optional("Track", track())
            .optional("StatusCallback", statusCallback())
            .optional("StatusCallbackMethod", statusCallbackMethod());
        int index = 1;
        for (Map.Entry<String, String> parameter : parameters.entrySet()) {
            writer.required("Parameter" + index + ".Name", parameter.getKey());
            writer.required("Parameter" + index + ".Value", parameter.getValue());
            index++;
        }
        return writer.build();
    }

    public String url() {
        return url;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<StreamTrack> track() {
        return Optional.ofNullable(track);
    }

    public Optional<String> statusCallback() {
        return Optional.ofNullable(statusCallback);
    }

    public Optional<CallbackMethod> statusCallbackMethod() {
        return Optional.ofNullable(statusCallbackMethod);
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    public static final class Builder {
        private final String url;
        private String name;
        private StreamTrack track;
        private String statusCallback;
        private CallbackMethod statusCallbackMethod;
        private final Map<String, String> parameters = new LinkedHashMap<>();

        private Builder(String url) {
            this.url = Objects.requireNonNull(url, "Url");
        }

        /**
         * Names the stream so it can later be stopped by name instead of SID.
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder track(StreamTrack track) {
            this.track = track;
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

        public Builder parameter(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (!parameters.containsKey(name) && parameters.size() == MAX_PARAMETERS) {
                throw new IllegalArgumentException("at most " + MAX_PARAMETERS + " stream parameters are allowed");
            }
            parameters.put(name, value);
            return this;
        }

        public CreateStreamBody build() {
            return new CreateStreamBody(this);
        }
    }
}
