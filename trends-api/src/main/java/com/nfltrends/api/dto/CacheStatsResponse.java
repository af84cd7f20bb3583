package com.nfltrends.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nfltrends.query.cache.CacheStats;

import java.time.Instant;
import java.util.Map;

public record CacheStatsResponse(
        @JsonProperty("upcoming_games_cache") CacheStats upcomingGamesCache,
        @JsonProperty("weekly_trends_cache") CacheStats weeklyTrendsCache,
        @JsonProperty("protected_keys") Map<String, String> protectedKeys,
        @JsonProperty("timestamp") Instant timestamp
) {
}
