package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.twiliovoice.sdk.endpoints.ApiVersion;

/**
 * Call resource as returned by the create, fetch, update and list call actions. Timestamps are kept in the RFC 2822
 * form the API sends them in.
 */
public record CallResource(
    String sid,
    @JsonProperty("date_created") String dateCreated,
    @JsonProperty("date_updated") String dateUpdated,
    @JsonProperty("parent_call_sid") String parentCallSid,
    @JsonProperty("account_sid") String accountSid,
    String to,
    @JsonProperty("to_formatted") String toFormatted,
    String from,
    @JsonProperty("from_formatted") String fromFormatted,
    @JsonProperty("phone_number_sid") String phoneNumberSid,
    CallStatus status,
    @JsonProperty("start_time") String startTime,
    @JsonProperty("end_time") String endTime,
    String duration,
    String price,
    @JsonProperty("price_unit") String priceUnit,
    String direction,
    @JsonProperty("answered_by") AnsweredBy answeredBy,
    @JsonProperty("api_version") ApiVersion apiVersion,
    @JsonProperty("forwarded_from") String forwardedFrom,
    @JsonProperty("group_sid") String groupSid,
    @JsonProperty("caller_name") String callerName,
    @JsonProperty("queue_time") String queueTime,
    @JsonProperty("trunk_sid") String trunkSid,
    String uri,
    @JsonProperty("subresource_uris") JsonNode subresourceUris,
    String annotation
) {
}
