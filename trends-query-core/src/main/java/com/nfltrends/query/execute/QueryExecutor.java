package com.nfltrends.query.execute;

import com.nfltrends.query.compile.CompiledQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs a compiled query against a {@link RecordStore}: the total is counted with the predicate
 * alone, then one page is fetched with sort, limit and offset applied.
 */
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    public <T> PagedResult<T> execute(RecordStore<T> store, CompiledQuery query) {
        long totalCount = store.count(query.predicate());
        List<T> page = totalCount == 0
                ? List.of()
                : store.find(query.predicate(), query.sort(), query.limit(), query.offset());

        log.debug("{} query matched {} records, returning {} (limit={}, offset={})",
                query.query().kind(), totalCount, page.size(), query.limit(), query.offset());
        return PagedResult.of(page, totalCount, query.limit(), query.offset());
    }
}
