package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

/**
 * Modifies a live call: redirect it to new TwiML or end it.
 */
public record UpdateCall(String accountSid, String callSid, UpdateCallBody body)
    implements Endpoint<UpdateCallBody, CallResource> {

    public UpdateCall {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(callSid, "CallSid");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Calls/{Sid}.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid, "Sid", callSid);
    }

    @Override
    public Class<CallResource> responseType() {
        return CallResource.class;
    }
}
