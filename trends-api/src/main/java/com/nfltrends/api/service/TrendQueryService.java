package com.nfltrends.api.service;

import com.nfltrends.api.model.TrendDocument;
import com.nfltrends.query.compile.CompiledQuery;
import com.nfltrends.query.compile.QueryCompiler;
import com.nfltrends.query.execute.PagedResult;
import com.nfltrends.query.execute.QueryExecutor;
import com.nfltrends.query.execute.RecordStore;
import com.nfltrends.query.schema.FilterSchemas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class TrendQueryService {

    private static final Logger log = LoggerFactory.getLogger(TrendQueryService.class);

    private final QueryCompiler queryCompiler;
    private final QueryExecutor queryExecutor;
    private final RecordStore<TrendDocument> trendStore;

    public TrendQueryService(QueryCompiler queryCompiler, QueryExecutor queryExecutor, RecordStore<TrendDocument> trendStore) {
        this.queryCompiler = queryCompiler;
        this.queryExecutor = queryExecutor;
        this.trendStore = trendStore;
    }

    public PagedResult<TrendDocument> findTrends(Map<String, ?> body) {
        CompiledQuery query = queryCompiler.compile(FilterSchemas.TRENDS, body);
        log.debug("Trends query: {}", query.predicate());
        return queryExecutor.execute(trendStore, query);
    }
}
