package com.nfltrends.api.service;

import com.nfltrends.api.model.WeeklyTrendDocument;
import com.nfltrends.query.cache.CacheKeyGenerator;
import com.nfltrends.query.cache.CacheKeys;
import com.nfltrends.query.cache.ResultCache;
import com.nfltrends.query.compile.QueryCompiler;
import com.nfltrends.query.execute.PagedResult;
import com.nfltrends.query.execute.QueryExecutor;
import com.nfltrends.query.execute.RecordStore;
import com.nfltrends.query.filter.NormalizedQuery;
import com.nfltrends.query.schema.FilterSchemas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weekly trends queries served through the LRU result cache.
 * <p>
 * Requests are keyed by the fingerprint of their normalized form. The startup query is stored
 * under {@link CacheKeys#INITIAL_WEEKLY_TRENDS} and any request normalizing to the same query
 * reads that entry. Failed queries are never cached.
 */
@Service
public class WeeklyTrendQueryService {

    private static final Logger log = LoggerFactory.getLogger(WeeklyTrendQueryService.class);

    private final QueryCompiler queryCompiler;
    private final QueryExecutor queryExecutor;
    private final RecordStore<WeeklyTrendDocument> weeklyTrendStore;
    private final ResultCache<PagedResult<WeeklyTrendDocument>> weeklyTrendsCache;
    private final CacheKeyGenerator cacheKeyGenerator;

    private volatile NormalizedQuery initialQuery;

    public WeeklyTrendQueryService(
            QueryCompiler queryCompiler,
            QueryExecutor queryExecutor,
            RecordStore<WeeklyTrendDocument> weeklyTrendStore,
            ResultCache<PagedResult<WeeklyTrendDocument>> weeklyTrendsCache,
            CacheKeyGenerator cacheKeyGenerator
    ) {
        this.queryCompiler = queryCompiler;
        this.queryExecutor = queryExecutor;
        this.weeklyTrendStore = weeklyTrendStore;
        this.weeklyTrendsCache = weeklyTrendsCache;
        this.cacheKeyGenerator = cacheKeyGenerator;
    }

    public PagedResult<WeeklyTrendDocument> findWeeklyTrends(Map<String, ?> body) {
        NormalizedQuery query = queryCompiler.normalize(FilterSchemas.WEEKLY_TRENDS, body);
        String key = cacheKey(query);

        Optional<PagedResult<WeeklyTrendDocument>> cached = weeklyTrendsCache.get(key);
        if (cached.isPresent()) {
            log.debug("Weekly trends cache hit: {}", key);
            return cached.get();
        }

        log.debug("Weekly trends cache miss: {}", key);
        PagedResult<WeeklyTrendDocument> result = execute(query);
        weeklyTrendsCache.put(key, result);
        return result;
    }

    /**
     * Computes the startup query for the given matchups and pins its result.
     */
    public PagedResult<WeeklyTrendDocument> warmInitialQuery(List<String> games) {
        NormalizedQuery query = queryCompiler.normalize(FilterSchemas.WEEKLY_TRENDS, InitialWeeklyTrendsQuery.body(games));
        PagedResult<WeeklyTrendDocument> result = execute(query);
        initialQuery = query;
        weeklyTrendsCache.put(CacheKeys.INITIAL_WEEKLY_TRENDS, result);
        log.info("Initial weekly trends query cached: {} of {} trends for {} games",
                result.count(), result.totalCount(), games.size());
        return result;
    }

    String cacheKey(NormalizedQuery query) {
        if (query.equals(initialQuery)) {
            return CacheKeys.INITIAL_WEEKLY_TRENDS;
        }
        return cacheKeyGenerator.fingerprint(query);
    }

    private PagedResult<WeeklyTrendDocument> execute(NormalizedQuery query) {
        return queryExecutor.execute(weeklyTrendStore, queryCompiler.compile(FilterSchemas.WEEKLY_TRENDS, query));
    }
}
