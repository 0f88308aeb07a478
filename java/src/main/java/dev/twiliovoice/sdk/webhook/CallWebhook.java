package dev.twiliovoice.sdk.webhook;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.ApiVersion;
import dev.twiliovoice.sdk.endpoints.voice.CallStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parameters Twilio sends with every voice webhook (TwiML fetches and call status callbacks). Parameters without a
 * dedicated accessor, such as {@code Digits} or {@code SpeechResult}, are available through {@link #extra()}.
 */
public final class CallWebhook {

    @JsonProperty("CallSid")
    private String callSid;
    @JsonProperty("AccountSid")
    private String accountSid;
    @JsonProperty("From")
    private String from;
    @JsonProperty("To")
    private String to;
    @JsonProperty("CallStatus")
    private CallStatus callStatus;
    @JsonProperty("ApiVersion")
    private ApiVersion apiVersion;
    @JsonProperty("Direction")
    private String direction;
    @JsonProperty("ForwardedFrom")
    private String forwardedFrom;
    @JsonProperty("CallerName")
    private String callerName;
    @JsonProperty("ParentCallSid")
    private String parentCallSid;
    @JsonProperty("CallToken")
    private String callToken;
    @JsonProperty("FromCity")
    private String fromCity;
    @JsonProperty("FromState")
    private String fromState;
    @JsonProperty("FromZip")
    private String fromZip;
    @JsonProperty("FromCountry")
    private String fromCountry;
    @JsonProperty("ToCity")
    private String toCity;
    @JsonProperty("ToState")
    private String toState;
    @JsonProperty("ToZip")
    private String toZip;
    @JsonProperty("ToCountry")
    private String toCountry;

    private final Map<String, String> extra = new LinkedHashMap<>();

    CallWebhook() {
    }

    @JsonAnySetter
    void putExtra(String name, String value) {
        extra.put(name, value);
    }

    public String callSid() {
        return callSid;
    }

    public String accountSid() {
        return accountSid;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }

    public CallStatus callStatus() {
        return callStatus;
    }

    public ApiVersion apiVersion() {
        return apiVersion;
    }

    /**
     * @return {@code inbound}, {@code outbound-api} or {@code outbound-dial}.
     */
    public String direction() {
        return direction;
    }

    public Optional<String> forwardedFrom() {
        return Optional.ofNullable(forwardedFrom);
    }

    public Optional<String> callerName() {
        return Optional.ofNullable(callerName);
    }

    public Optional<String> parentCallSid() {
        return Optional.ofNullable(parentCallSid);
    }

    public Optional<String> callToken() {
        return Optional.ofNullable(callToken);
    }

    public Optional<String> fromCity() {
        return Optional.ofNullable(fromCity);
    }

    public Optional<String> fromState() {
        return Optional.ofNullable(fromState);
    }

    public Optional<String> fromZip() {
        return Optional.ofNullable(fromZip);
    }

    public Optional<String> fromCountry() {
        return Optional.ofNullable(fromCountry);
    }

    public Optional<String> toCity() {
        return Optional.ofNullable(toCity);
    }

    public Optional<String> toState() {
        return Optional.ofNullable(toState);
    }

    public Optional<String> toZip() {
        return Optional.ofNullable(toZip);
    }

    public Optional<String> toCountry() {
        return Optional.ofNullable(toCountry);
    }

    public boolean isNoAnswer() {
        return callStatus == CallStatus.NO_ANSWER;
    }

    public Map<String, String> extra() {
        return Collections.unmodifiableMap(extra);
    }

    public Optional<String> extra(String name) {
        return Optional.ofNullable(extra.get(name));
    }

    @Override
    public String toString() {
        return "CallWebhook{callSid=" + callSid + ", callStatus=" + callStatus + ", direction=" + direction + '}';
    }
}
