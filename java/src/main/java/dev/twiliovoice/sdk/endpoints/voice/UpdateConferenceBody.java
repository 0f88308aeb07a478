package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.CallbackMethod;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.FormWriter;
import dev.twiliovoice.sdk.endpoints.RequestBody;

import java.util.List;
import java.util.Optional;

/**
 * Payload of an update conference request: end the conference or play an announcement to every participant.
 */
public final class UpdateConferenceBody implements RequestBody {

    private final boolean end;
    private final String announceUrl;
    private final CallbackMethod announceMethod;

    private UpdateConferenceBody(boolean end, String announceUrl, CallbackMethod announceMethod) {
        this.end = end;
        this.announceUrl = announceUrl;
        this.announceMethod = announceMethod;
    }

    /**
     * Ends the conference and disconnects every participant.
     */
    public static UpdateConferenceBody end() {
        return new UpdateConferenceBody(true, null, null);
    }

    public static UpdateConferenceBody announce(String announceUrl, CallbackMethod announceMethod) {
        if (announceUrl == null || announceUrl.isBlank()) {
            throw new IllegalArgumentException("AnnounceUrl is required");
        }
        return new UpdateConferenceBody(false, announceUrl, announceMethod);
    }

    @Override
    public List<FormParam> params() {
        return new FormWriter()
            .optional("Status", end ? Optional.of(ConferenceStatus.COMPLETED) : Optional.empty())
            .optional("AnnounceUrl", announceUrl())
            .optional("AnnounceMethod", announceMethod())
            .build();
    }

    public boolean ends() {
        return end;
    }

    public Optional<String> announceUrl() {
        return Optional.ofNullable(announceUrl);
    }

    public Optional<CallbackMethod> announceMethod() {
        return Optional.ofNullable(announceMethod);
    }
}
