package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.List;
import java.util.Map;

public record ListParticipants(String accountSid, String conferenceSid, List<FormParam> queryParams)
    implements Endpoint<EmptyBody, ParticipantPage> {

    public ListParticipants {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(conferenceSid, "ConferenceSid");
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
    }

    public ListParticipants(String accountSid, String conferenceSid) {
        this(accountSid, conferenceSid, List.of());
    }

    public ListParticipants(String accountSid, String conferenceSid, ParticipantQuery query) {
        this(accountSid, conferenceSid, query.params());
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
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
    public EmptyBody body() {
        return EmptyBody.INSTANCE;
    }

    @Override
    public Class<ParticipantPage> responseType() {
        return ParticipantPage.class;
    }
}
