package dev.twiliovoice.sdk.endpoints.accounts;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Account (or subaccount) as returned by the accounts actions.
 *
 * @param authToken       secret token of the account; keep it out of logs.
 * @param ownerAccountSid parent of a subaccount, or the account itself for a main account.
 */
public record AccountResource(
    String sid,
    @JsonProperty("auth_token") String authToken,
    @JsonProperty("date_created") String dateCreated,
    @JsonProperty("date_updated") String dateUpdated,
    @JsonProperty("friendly_name") String friendlyName,
    @JsonProperty("owner_account_sid") String ownerAccountSid,
    AccountStatus status,
    AccountType type,
    String uri,
    @JsonProperty("subresource_uris") JsonNode subresourceUris
) {

    @Override
    public String toString() {
        return "AccountResource{sid=" + sid + ", friendlyName=" + friendlyName + ", status=" + status
            + ", type=" + type + '}';
    }
}
