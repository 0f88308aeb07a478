package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;

public record FetchConference(String accountSid, String conferenceSid)
    implements Endpoint<EmptyBody, ConferenceResource> {

    public FetchConference {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(conferenceSid, "ConferenceSid");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Conferences/{Sid}.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid, "Sid", conferenceSid);
    }

    @Override
    public EmptyBody body() {
        return EmptyBody.INSTANCE;
    }

    @Override
    public Class<ConferenceResource> responseType() {
        return ConferenceResource.class;
    }
}
