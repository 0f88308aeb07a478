package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.EmptyBody;
import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;

/**
 * Removes a call record from the account's logs. Answers with {@code 204 No Content}.
 */
public record DeleteCall(String accountSid, String callSid) implements Endpoint<EmptyBody, Void> {

    public DeleteCall {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(callSid, "CallSid");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.DELETE;
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
    public EmptyBody body() {
        return EmptyBody.INSTANCE;
    }

    @Override
    public Class<Void> responseType() {
        return Void.class;
    }
}
