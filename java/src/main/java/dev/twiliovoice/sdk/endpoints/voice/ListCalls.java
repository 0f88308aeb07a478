package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.List;
import java.util.Map;

/**
 * Reads one page of calls. Follow {@link CallPage#nextPageUri()} yourself to walk further pages.
 */
public record ListCalls(String accountSid, List<FormParam> queryParams) implements Endpoint<EmptyBody, CallPage> {

    public ListCalls {
        Endpoint.requireId(accountSid, "AccountSid");
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
    }

    public ListCalls(String accountSid) {
        this(accountSid, List.of());
    }

    public ListCalls(String accountSid, CallQuery query) {
        this(accountSid, query.params());
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Calls.json";
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
    public Class<CallPage> responseType() {
        return CallPage.class;
    }
}
