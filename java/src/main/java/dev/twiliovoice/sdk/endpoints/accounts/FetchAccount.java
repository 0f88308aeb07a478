package dev.twiliovoice.sdk.endpoints.accounts;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;

public record FetchAccount(String accountSid) implements Endpoint<EmptyBody, AccountResource> {

    public FetchAccount {
        Endpoint.requireId(accountSid, "AccountSid");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{Sid}.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("Sid", accountSid);
    }

    @Override
    public EmptyBody body() {
        return EmptyBody.INSTANCE;
    }

    @Override
    public Class<AccountResource> responseType() {
        return AccountResource.class;
    }
}
