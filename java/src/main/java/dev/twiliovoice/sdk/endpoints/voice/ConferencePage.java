package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.PageInfo;

import java.util.List;

public record ConferencePage(
    List<ConferenceResource> conferences,
    Integer page,
    @JsonProperty("page_size") Integer pageSize,
    String uri,
    @JsonProperty("first_page_uri") String firstPageUri,
    @JsonProperty("next_page_uri") String nextPageUri,
    @JsonProperty("previous_page_uri") String previousPageUri
) {

    public ConferencePage {
        conferences = conferences == null ? List.of() : List.copyOf(conferences);
    }

    public PageInfo pageInfo() {
        return new PageInfo(page, pageSize, uri, firstPageUri, nextPageUri, previousPageUri);
    }
}
