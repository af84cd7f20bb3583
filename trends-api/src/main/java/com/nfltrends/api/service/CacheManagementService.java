package com.nfltrends.api.service;

import com.nfltrends.api.dto.CacheStatsResponse;
import com.nfltrends.api.dto.MessageResponse;
import com.nfltrends.api.dto.ProtectedEntriesResponse;
import com.nfltrends.api.dto.UpcomingGamesResponse;
import com.nfltrends.api.model.WeeklyTrendDocument;
import com.nfltrends.query.cache.CacheKeys;
import com.nfltrends.query.cache.ResultCache;
import com.nfltrends.query.execute.PagedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class CacheManagementService {

    private static final Logger log = LoggerFactory.getLogger(CacheManagementService.class);

    private final ResultCache<UpcomingGamesResponse> upcomingGamesCache;
    private final ResultCache<PagedResult<WeeklyTrendDocument>> weeklyTrendsCache;

    public CacheManagementService(
            ResultCache<UpcomingGamesResponse> upcomingGamesCache,
            ResultCache<PagedResult<WeeklyTrendDocument>> weeklyTrendsCache
    ) {
        this.upcomingGamesCache = upcomingGamesCache;
        this.weeklyTrendsCache = weeklyTrendsCache;
    }

    public CacheStatsResponse stats() {
        Map<String, String> protectedKeys = new LinkedHashMap<>();
        protectedKeys.put("upcoming_games", CacheKeys.UPCOMING_GAMES);
        protectedKeys.put("weekly_trends", CacheKeys.INITIAL_WEEKLY_TRENDS);
        return new CacheStatsResponse(upcomingGamesCache.stats(), weeklyTrendsCache.stats(), protectedKeys, Instant.now());
    }

    public MessageResponse clearUpcomingGames(boolean preserveDefault) {
        upcomingGamesCache.clear(preserveDefault);
        log.info("Upcoming games cache cleared (preserveDefault={})", preserveDefault);
        return new MessageResponse(preserveDefault
                ? "Upcoming games cache cleared (default entry preserved)"
                : "Upcoming games cache cleared (all entries removed)");
    }

    public MessageResponse clearWeeklyTrends(boolean preserveInitial) {
        weeklyTrendsCache.clear(preserveInitial);
        log.info("Weekly trends cache cleared (preserveInitial={})", preserveInitial);
        return new MessageResponse(preserveInitial
                ? "Weekly trends cache cleared (initial query preserved)"
                : "Weekly trends cache cleared (all entries removed)");
    }

    public MessageResponse clearAll(boolean preserveProtected) {
        upcomingGamesCache.clear(preserveProtected);
        weeklyTrendsCache.clear(preserveProtected);
        log.info("All caches cleared (preserveProtected={})", preserveProtected);
        return new MessageResponse(preserveProtected
                ? "All caches cleared (protected entries preserved)"
                : "All caches cleared (all entries removed)");
    }

    public ProtectedEntriesResponse protectedEntries() {
        ProtectedEntriesResponse.Entry upcoming = upcomingGamesCache.get(CacheKeys.UPCOMING_GAMES)
                .map(response -> new ProtectedEntriesResponse.Entry(true, response.totalCount()))
                .orElse(new ProtectedEntriesResponse.Entry(false, 0));
        ProtectedEntriesResponse.Entry initial = weeklyTrendsCache.get(CacheKeys.INITIAL_WEEKLY_TRENDS)
                .map(result -> new ProtectedEntriesResponse.Entry(true, result.count()))
                .orElse(new ProtectedEntriesResponse.Entry(false, 0));
        return new ProtectedEntriesResponse(upcoming, initial);
    }
}
