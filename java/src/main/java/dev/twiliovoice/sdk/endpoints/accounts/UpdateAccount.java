package dev.twiliovoice.sdk.endpoints.accounts;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

/**
 * Renames an account or changes its status. Closing an account cannot be undone.
 */
public record UpdateAccount(String accountSid, AccountBody body) implements Endpoint<AccountBody, AccountResource> {

    public UpdateAccount {
        Endpoint.requireId(accountSid, "AccountSid");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
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
    public Class<AccountResource> responseType() {
        return AccountResource.class;
    }
}
