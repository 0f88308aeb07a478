package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

public record CreateParticipant(String accountSid, String conferenceSid, CreateParticipantBody body)
    implements Endpoint<CreateParticipantBody, ParticipantResource> {

    public CreateParticipant {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(conferenceSid, "ConferenceSid");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Conferences/{ConferenceSid}/Participants.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid, "ConferenceSid", conferenceSid);
    }

    @Override
    public Class<ParticipantResource> responseType() {
        return ParticipantResource.class;
    }
}
