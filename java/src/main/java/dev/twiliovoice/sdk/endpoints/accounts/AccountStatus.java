package dev.twiliovoice.sdk.endpoints.accounts;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.WireValue;

public enum AccountStatus implements WireValue {
    @JsonProperty("active")
    ACTIVE("active"),
    @JsonProperty("suspended")
    SUSPENDED("suspended"),
    @JsonProperty("closed")
    CLOSED("closed");

    private final String wireValue;

    AccountStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
