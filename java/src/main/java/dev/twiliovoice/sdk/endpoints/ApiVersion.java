package dev.twiliovoice.sdk.endpoints;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ApiVersion implements WireValue {
    @JsonProperty("2010-04-01")
    V2010_04_01("2010-04-01"),
    @JsonProperty("2008-08-01")
    V2008_08_01("2008-08-01");

    private final String wireValue;

    ApiVersion(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
