package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.twiliovoice.sdk.endpoints.ApiVersion;

/**
 * Conference resource. {@code reasonConferenceEnded} and {@code callSidEndingConference} are only populated once the
 * conference has completed.
 */
public record ConferenceResource(
    String sid,
    @JsonProperty("account_sid") String accountSid,
    @JsonProperty("date_created") String dateCreated,
    @JsonProperty("date_updated") String dateUpdated,
    @JsonProperty("api_version") ApiVersion apiVersion,
    @JsonProperty("friendly_name") String friendlyName,
    String region,
    ConferenceStatus status,
    String uri,
    @JsonProperty("subresource_uris") JsonNode subresourceUris,
    @JsonProperty("reason_conference_ended") String reasonConferenceEnded,
    @JsonProperty("call_sid_ending_conference") String callSidEndingConference
) {
}
