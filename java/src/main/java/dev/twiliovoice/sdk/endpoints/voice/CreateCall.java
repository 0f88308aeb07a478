package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

/**
 * Places an outbound call from the given account.
 */
public record CreateCall(String accountSid, CreateCallBody body) implements Endpoint<CreateCallBody, CallResource> {

    public CreateCall {
        Endpoint.requireId(accountSid, "AccountSid");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Calls.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid);
    }

    @Override
    public Class<CallResource> responseType() {
        return CallResource.class;
    }
}
