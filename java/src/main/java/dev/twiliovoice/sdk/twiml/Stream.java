package dev.twiliovoice.sdk.twiml;

import dev.twiliovoice.sdk.TwimlException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <Stream>} noun: connects the call audio to a WebSocket server.
 */
public final class Stream {

    private final String url;
    private final String name;
    private final Track track;
    private final String statusCallback;
    private final String statusCallbackMethod;
    private final List<Parameter> parameters;

    private Stream(String url, String name, Track track, String statusCallback, String statusCallbackMethod,
                   List<Parameter> parameters) {
        this.url = url;
        this.name = name;
        this.track = track;
        this.statusCallback = statusCallback;
        this.statusCallbackMethod = statusCallbackMethod;
        this.parameters = List.copyOf(parameters);
    }

    /**
     * Stream with only a URL. The URL is checked when the document is rendered.
     */
    public static Stream of(String url) {
        return new Stream(Objects.requireNonNull(url, "url"), null, null, null, null, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public String url() {
        return url;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<Track> track() {
        return Optional.ofNullable(track);
    }

    public Optional<String> statusCallback() {
        return Optional.ofNullable(statusCallback);
    }

    public Optional<String> statusCallbackMethod() {
        return Optional.ofNullable(statusCallbackMethod);
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    /**
     * Media streams only run over TLS WebSockets.
     *
     * @throws TwimlException when {@code url} does not parse or is not a {@code wss://} URL.
     */
    static String requireWebSocketUrl(String url) throws TwimlException {
        requireUri(url, "stream url");
        if (!url.startsWith("wss://")) {
            throw new TwimlException("stream url must start with 'wss://': " + url);
        }
        return url;
    }

    static String requireUri(String value, String what) throws TwimlException {
        if (value == null || value.isBlank()) {
            throw new TwimlException(what + " is required");
        }
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null) {
                throw new TwimlException(what + " must be absolute: " + value);
            }
        } catch (URISyntaxException ex) {
            throw new TwimlException("invalid " + what + ": " + value, ex);
        }
        return value;
    }

    public static final class Builder {
        private String url;
        private String name;
        private Track track;
        private String statusCallback;
        private String statusCallbackMethod;
        private final List<Parameter> parameters = new ArrayList<>();

        private Builder() {
        }

        public Builder url(String url) throws TwimlException {
            this.url = requireWebSocketUrl(url);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder track(Track track) {
            this.track = track;
            return this;
        }

        public Builder statusCallback(String statusCallback) throws TwimlException {
            this.statusCallback = requireUri(statusCallback, "status callback");
            return this;
        }

        public Builder statusCallbackMethod(String statusCallbackMethod) {
            this.statusCallbackMethod = statusCallbackMethod;
            return this;
        }

        public Builder parameter(String name, String value) {
            parameters.add(new Parameter(name, value));
            return this;
        }

        public Stream build() throws TwimlException {
            if (url == null) {
                throw new TwimlException("stream url is required");
            }
            return new Stream(url, name, track, statusCallback, statusCallbackMethod, parameters);
        }
    }
}
