package com.nfltrends.query.execute;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of query results. {@code totalCount} is the number of matches before pagination and
 * {@code count} the number of records on this page.
 */
public record PagedResult<T>(
        @JsonProperty("count") int count,
        @JsonProperty("total_count") long totalCount,
        @JsonProperty("limit") int limit,
        @JsonProperty("offset") int offset,
        @JsonProperty("results") List<T> results
) {

    public PagedResult {
        results = List.copyOf(results);
    }

    public static <T> PagedResult<T> of(List<T> results, long totalCount, int limit, int offset) {
        return new PagedResult<>(results.size(), totalCount, limit, offset, results);
    }
}
