package dev.twiliovoice.sdk.endpoints.accounts;

import dev.twiliovoice.sdk.endpoints.PageQuery;

/**
 * Filters accepted by {@link ListAccounts}.
 */
public final class AccountQuery extends PageQuery<AccountQuery> {

    @Override
    protected AccountQuery self() {
        return this;
    }

    public AccountQuery friendlyName(String friendlyName) {
        return add("FriendlyName", friendlyName);
    }

    public AccountQuery status(AccountStatus status) {
        return add("Status", status);
    }
}
