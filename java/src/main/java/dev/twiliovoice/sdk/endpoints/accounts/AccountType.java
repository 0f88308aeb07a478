package dev.twiliovoice.sdk.endpoints.accounts;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Either a trial account or one that has been upgraded.
 */
public enum AccountType {
    @JsonProperty("Trial")
    TRIAL,
    @JsonProperty("Full")
    FULL
}
