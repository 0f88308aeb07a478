package dev.twiliovoice.sdk.endpoints.applications;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;

public record DeleteApplication(String accountSid, String applicationSid) implements Endpoint<EmptyBody, Void> {

    public DeleteApplication {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(applicationSid, "ApplicationSid");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.DELETE;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Applications/{Sid}.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid, "Sid", applicationSid);
    }

    @Override
    public EmptyBody body() {
        return EmptyBody.INSTANCE;
    }

    @Override
    public Class<Void> responseType() {
        return Void.class;
    }
}
