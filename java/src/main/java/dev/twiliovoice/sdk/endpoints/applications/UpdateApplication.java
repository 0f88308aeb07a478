package dev.twiliovoice.sdk.endpoints.applications;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

public record UpdateApplication(String accountSid, String applicationSid, ApplicationBody body)
    implements Endpoint<ApplicationBody, ApplicationResource> {

    public UpdateApplication {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(applicationSid, "ApplicationSid");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
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
    public Class<ApplicationResource> responseType() {
        return ApplicationResource.class;
    }
}
