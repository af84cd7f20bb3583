package com.nfltrends.api.config;

import com.nfltrends.api.dto.UpcomingGamesResponse;
import com.nfltrends.api.model.WeeklyTrendDocument;
import com.nfltrends.query.cache.CacheKeyGenerator;
import com.nfltrends.query.cache.CacheKeys;
import com.nfltrends.query.cache.ExpiringResultCache;
import com.nfltrends.query.cache.LruResultCache;
import com.nfltrends.query.cache.ResultCache;
import com.nfltrends.query.compile.MatchupResolver;
import com.nfltrends.query.compile.PredicateCompiler;
import com.nfltrends.query.compile.QueryCompiler;
import com.nfltrends.query.compile.RangeResolver;
import com.nfltrends.query.execute.PagedResult;
import com.nfltrends.query.execute.QueryExecutor;
import com.nfltrends.query.filter.FilterNormalizer;
import com.nfltrends.query.sort.SortCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Wires the query engine and the two result caches.
 */
@Configuration
public class QueryEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(QueryEngineConfig.class);

    @Bean
    public QueryCompiler queryCompiler() {
        FilterNormalizer normalizer = new FilterNormalizer(new SortCompiler());
        PredicateCompiler predicateCompiler = new PredicateCompiler(new RangeResolver(), new MatchupResolver());
        return new QueryCompiler(normalizer, predicateCompiler);
    }

    @Bean
    public QueryExecutor queryExecutor() {
        return new QueryExecutor();
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator() {
        return new CacheKeyGenerator();
    }

    @Bean
    public ResultCache<UpcomingGamesResponse> upcomingGamesCache(TrendsCacheProperties properties) {
        TrendsCacheProperties.UpcomingGames config = properties.getUpcomingGames();
        log.info("Upcoming games cache: maxSize={} ttl={}", config.getMaxSize(), config.getTtl());
        return new ExpiringResultCache<>(config.getMaxSize(), config.getTtl(), Set.of(CacheKeys.UPCOMING_GAMES));
    }

    @Bean
    public ResultCache<PagedResult<WeeklyTrendDocument>> weeklyTrendsCache(TrendsCacheProperties properties) {
        int maxSize = properties.getWeeklyTrends().getMaxSize();
        log.info("Weekly trends cache: maxSize={}", maxSize);
        return new LruResultCache<>(maxSize, Set.of(CacheKeys.INITIAL_WEEKLY_TRENDS));
    }
}
