package com.nfltrends.query.filter;

import com.nfltrends.query.sort.SortSpec;

import java.util.Objects;

/**
 * Everything that determines a query result: record kind, validated filter, sort and page.
 * Two requests with equal normalized queries always return the same result.
 */
public record NormalizedQuery(String kind, FilterDocument filter, SortSpec sort, PageRequest page) {

    public NormalizedQuery {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(sort, "sort");
        Objects.requireNonNull(page, "page");
    }
}
