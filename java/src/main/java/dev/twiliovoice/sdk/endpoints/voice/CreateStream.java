package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.HttpMethod;

import java.util.Map;
import java.util.Objects;

public record CreateStream(String accountSid, String callSid, CreateStreamBody body)
    implements Endpoint<CreateStreamBody, StreamResource> {

    public CreateStream {
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
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Calls/{CallSid}/Streams.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid, "CallSid", callSid);
    }

    @Override
    public Class<StreamResource> responseType() {
        return StreamResource.class;
    }
}
