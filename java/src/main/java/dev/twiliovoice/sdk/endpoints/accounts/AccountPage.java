package dev.twiliovoice.sdk.endpoints.accounts;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.twiliovoice.sdk.endpoints.PageInfo;

import java.util.List;

public record AccountPage(
    List<AccountResource> accounts,
    Integer page,
    @JsonProperty("page_size") Integer pageSize,
    String uri,
    @JsonProperty("first_page_uri") String firstPageUri,
    @JsonProperty("next_page_uri") String nextPageUri,
    @JsonProperty("previous_page_uri") String previousPageUri
) {

    public AccountPage {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public PageInfo pageInfo() {
        return new PageInfo(page, pageSize, uri, firstPageUri, nextPageUri, previousPageUri);
    }
}
