package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.Endpoint;
import dev.twiliovoice.sdk.endpoints.FormParam;
import dev.twiliovoice.sdk.endpoints.HttpMethod;
import dev.twiliovoice.sdk.endpoints.RequestBody;

import java.util.List;
import java.util.Map;

/**
 * Stops a media stream. {@code streamSidOrName} is either the {@code MZ...} SID or the name given at creation.
 */
public record StopStream(String accountSid, String callSid, String streamSidOrName)
    implements Endpoint<StopStream.Body, StreamResource> {

    public StopStream {
        Endpoint.requireId(accountSid, "AccountSid");
        Endpoint.requireId(callSid, "CallSid");
        Endpoint.requireId(streamSidOrName, "Sid");
    }

    @Override
    public HttpMethod method() {
        return HttpMethod.POST;
    }

    @Override
    public String pathTemplate() {
        return API_VERSION_PREFIX + "/Accounts/{AccountSid}/Calls/{CallSid}/Streams/{Sid}.json";
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of("AccountSid", accountSid, "CallSid", callSid, "Sid", streamSidOrName);
    }

    @Override
    public Body body() {
        return Body.INSTANCE;
    }

    @Override
    public Class<StreamResource> responseType() {
        return StreamResource.class;
    }

    /**
     * The only update a stream accepts.
     */
    public static final class Body implements RequestBody {

        static final Body INSTANCE = new Body();

        private Body() {
        }

        @Override
        public List<FormParam> params() {
            return List.of(new FormParam("Status", StreamStatus.STOPPED.wireValue()));
        }
    }
}
