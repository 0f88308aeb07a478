package dev.twiliovoice.sdk.endpoints;

/**
 * Paging metadata returned alongside list results. The SDK does not follow {@code nextPageUri} on its own.
 */
public record PageInfo(
    Integer page,
    Integer pageSize,
    String uri,
    String firstPageUri,
    String nextPageUri,
    String previousPageUri
) {

    public boolean hasNextPage() {
        return nextPageUri != null && !nextPageUri.isBlank();
    }
}
