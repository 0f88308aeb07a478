package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

public record UpdateParticipant(String accountSid, String conferenceSid, String callSid, UpdateParticipantBody body)
    implements Endpoint<UpdateParticipantBody, ParticipantResource> {

    public UpdateParticipant {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(conferenceSid, "ConferenceSid");
        Endpoint.requireId(callSid, "CallSid");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Conferences/{ConferenceSid}/Participants/{CallSid}.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid, "ConferenceSid", conferenceSid, "CallSid", callSid);
    }

    @Override
    public Class<ParticipantResource> responseType() {
        return ParticipantResource.class;
    }
}
