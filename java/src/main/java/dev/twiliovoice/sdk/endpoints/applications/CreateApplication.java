package dev.twiliovoice.sdk.endpoints.applications;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

public record CreateApplication(String accountSid, ApplicationBody body)
    implements Endpoint<ApplicationBody, ApplicationResource> {

    public CreateApplication {
        Endpoint.requireId(accountSid, "AccountSid");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
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
    public Class<ApplicationResource> responseType() {
        return ApplicationResource.class;
    }
}
