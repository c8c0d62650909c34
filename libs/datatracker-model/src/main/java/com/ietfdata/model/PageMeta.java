package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * The {@code meta} block of a list response.
 *
 * @param limit      page size the service applied
 * @param offset     index of the first object on this page
 * @param totalCount number of objects matching the query across all pages
 * @param next       relative path of the next page, null on the last page
 * @param previous   relative path of the previous page, null on the first page
 */
public record PageMeta(
        int limit,
        int offset,
        @JsonProperty("total_count") long totalCount,
        String next,
        String previous) {

    /** The next-page link, empty when absent or blank. */
    public Optional<String> nextPage() {
        return next == null || next.isBlank() ? Optional.empty() : Optional.of(next);
    }
}
