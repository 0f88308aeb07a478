package dev.twiliovoice.sdk.endpoints.applications;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.List;
import java.util.Map;

public record ListApplications(String accountSid, List<FormParam> queryParams)
    implements Endpoint<EmptyBody, ApplicationPage> {

    public ListApplications {
        Endpoint.requireId(accountSid, "AccountSid");
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
    }

    public ListApplications(String accountSid) {
        this(accountSid, List.of());
    }

    public ListApplications(String accountSid, ApplicationQuery query) {
        this(accountSid, query.params());
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Applications.json";
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
    public Class<ApplicationPage> responseType() {
        return ApplicationPage.class;
    }
}
