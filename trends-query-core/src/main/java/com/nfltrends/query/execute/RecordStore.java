package com.nfltrends.query.execute;

import com.nfltrends.query.predicate.Predicate;
import com.nfltrends.query.sort.SortSpec;

import java.util.List;

/**
 * Storage collaborator of the query engine. Implementations translate compiled predicates and
 * sorts into their native query facility. Failures propagate to the caller unchanged.
 */
public interface RecordStore<T> {

    List<T> find(Predicate predicate, SortSpec sort, int limit, int offset);

    /**
     * Number of records matching the predicate, ignoring any sort or pagination.
     */
    long count(Predicate predicate);
}
