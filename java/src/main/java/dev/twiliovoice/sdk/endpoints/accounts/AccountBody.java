package dev.twiliovoice.sdk.endpoints.accounts;

import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.FormWriter;
import dev.twiliovoice.sdk.endpoints.RequestBody;

import java.util.List;
import java.util.Optional;

/**
 * Payload of the create and update account actions. Both fields are optional; {@code Status} is only honoured on
 * update.
 */
public final class AccountBody implements RequestBody {

    private final String friendlyName;
    private final AccountStatus status;

    public AccountBody(String friendlyName, AccountStatus status) {
        this.friendlyName = friendlyName;
        this.status = status;
    }

    public static AccountBody named(String friendlyName) {
        return new AccountBody(friendlyName, null);
    }

    public static AccountBody withStatus(AccountStatus status) {
        return new AccountBody(null, status);
    }

    @Override
    public List<FormParam> params() {
        return new FormWriter()
            .optional("FriendlyName", friendlyName())
            .optional("Status", status())
            .build();
    }

    public Optional<String> friendlyName() {
        return Optional.ofNullable(friendlyName);
    }

    public Optional<AccountStatus> status() {
        return Optional.ofNullable(status);
    }
}
