package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;

public record FetchParticipant(String accountSid, String conferenceSid, String callSid)
    implements Endpoint<EmptyBody, ParticipantResource> {

    public FetchParticipant {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(conferenceSid, "ConferenceSid");
        Endpoint.requireId(callSid, "CallSid");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
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
    public EmptyBody body() {
        return EmptyBody.INSTANCE;
    }

    @Override
    public Class<ParticipantResource> responseType() {
        return ParticipantResource.class;
    }
}
