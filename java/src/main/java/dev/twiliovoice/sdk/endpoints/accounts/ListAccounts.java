package dev.twiliovoice.sdk.endpoints.accounts;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.List;
import java.util.Map;

/**
 * Reads one page of the authenticating account and its subaccounts.
 */
public record ListAccounts(List<FormParam> queryParams) implements Endpoint<EmptyBody, AccountPage> {

    public ListAccounts {
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
    }

    public ListAccounts() {
        this(List.of());
    }

    public ListAccounts(AccountQuery query) {
        this(query.params());
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
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
    public EmptyBody body() {
        return EmptyBody.INSTANCE;
    }

    @Override
    public Class<AccountPage> responseType() {
        return AccountPage.class;
    }
}
