package dev.twiliovoice.sdk.endpoints.applications;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.PageInfo;

import java.util.List;

public record ApplicationPage(
    List<ApplicationResource> applications,
    Integer page,
    @JsonProperty("page_size") Integer pageSize,
    String uri,
    @JsonProperty("first_page_uri") String firstPageUri,
    @JsonProperty("next_page_uri") String nextPageUri,
    @JsonProperty("previous_page_uri") String previousPageUri
) {

    public ApplicationPage {
        applications = applications == null ? List.of() : List.copyOf(applications);
    }

    public PageInfo pageInfo() {
        return new PageInfo(page, pageSize, uri, firstPageUri, nextPageUri, previousPageUri);
    }
}
