package dev.twiliovoice.sdk.endpoints.accounts;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

/**
 * Creates a subaccount under the authenticating account.
 */
public record CreateAccount(AccountBody body) implements Endpoint<AccountBody, AccountResource> {

    public CreateAccount {
        Objects.requireNonNull(body, "body");
    }

    public CreateAccount(String friendlyName) {
        this(AccountBody.named(friendlyName));
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of();
    }

    @Override
    public Class<AccountResource> responseType() {
        return AccountResource.class;
    }
}
