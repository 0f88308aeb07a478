package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.List;
import java.util.Map;

public record ListConferences(String accountSid, List<FormParam> queryParams)
    implements Endpoint<EmptyBody, ConferencePage> {

    public ListConferences {
        Endpoint.requireId(accountSid, "AccountSid");
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
    }

    public ListConferences(String accountSid) {
        this(accountSid, List.of());
    }

    public ListConferences(String accountSid, ConferenceQuery query) {
        this(accountSid, query.params());
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Conferences.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid);
    }

    @Override
    public EmptyBody body() {
        return EmptyBody.INSTANCE;
    }

    @Override
    public Class<ConferencePage> responseType() {
        return ConferencePage.class;
    }
}
