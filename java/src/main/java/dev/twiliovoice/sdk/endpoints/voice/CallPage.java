package dev.twiliovoice.sdk.endpoints.voice;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.PageInfo;

import java.util.List;

public record CallPage(
    List<CallResource> calls,
    Integer page,
    @JsonProperty("page_size") Integer pageSize,
    String uri,
    @JsonProperty("first_page_uri") String firstPageUri,
    @JsonProperty("next_page_uri") String nextPageUri,
    @JsonProperty("previous_page_uri") String previousPageUri
) {

    public CallPage {
        calls = calls == null ? List.of() : List.copyOf(calls);
    }

    public PageInfo pageInfo() {
        return new PageInfo(page, pageSize, uri, firstPageUri, nextPageUri, previousPageUri);
    }
}
