package com.nfltrends.query.compile;

import com.nfltrends.query.filter.NormalizedQuery;
import com.nfltrends.query.predicate.Predicate;
import com.nfltrends.query.sort.SortSpec;

/**
 * A normalized query together with its compiled predicate, ready for a record store.
 */
public record CompiledQuery(NormalizedQuery query, Predicate predicate) {

    public SortSpec sort() {
        return query.sort();
    }

    public int limit() {
        return query.page().limit();
    }

    public int offset() {
        return query.page().offset();
    }
}
