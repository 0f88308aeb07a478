package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.PageInfo;

import java.util.List;

public record ParticipantPage(
    List<ParticipantResource> participants,
    Integer page,
    @JsonProperty("page_size") Integer pageSize,
    String uri,
    @JsonProperty("first_page_uri") String firstPageUri,
    @JsonProperty("next_page_uri") String nextPageUri,
    @JsonProperty("previous_page_uri") String previousPageUri
) {

    public ParticipantPage {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public PageInfo pageInfo() {
        return new PageInfo(page, pageSize, uri, firstPageUri, nextPageUri, previousPageUri);
    }
}
