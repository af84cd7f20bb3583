package com.nfltrends.api.service;

import com.nfltrends.api.config.TrendsCacheProperties;
import com.nfltrends.api.dto.UpcomingGamesResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fills the protected cache entries once the application is ready.
 */
@Service
public class CacheWarmupService {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmupService.class);

    private final TrendsCacheProperties properties;
    private final UpcomingGameService upcomingGameService;
    private final WeeklyTrendQueryService weeklyTrendQueryService;

    public CacheWarmupService(
            TrendsCacheProperties properties,
            UpcomingGameService upcomingGameService,
            WeeklyTrendQueryService weeklyTrendQueryService
    ) {
        this.properties = properties;
        this.upcomingGameService = upcomingGameService;
        this.weeklyTrendQueryService = weeklyTrendQueryService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isWarmUpEnabled()) {
            log.info("Cache warm-up disabled");
            return;
        }
        warmUp();
    }

    /**
     * @return true when both protected entries were stored
     */
    public boolean warmUp() {
        log.info("Warming up caches");
        UpcomingGamesResponse upcoming;
        try {
            upcoming = upcomingGameService.refresh();
        } catch (RuntimeException e) {
            log.error("Failed to load upcoming games during warm-up", e);
            return false;
        }

        List<String> games = UpcomingGameService.matchupStrings(upcoming.upcomingGames());
        if (games.isEmpty()) {
            log.warn("No upcoming matchups, skipping initial weekly trends query");
            return false;
        }

        try {
            weeklyTrendQueryService.warmInitialQuery(games);
        } catch (RuntimeException e) {
            log.error("Failed to compute initial weekly trends query for {}", games, e);
            return false;
        }
        log.info("Cache warm-up complete");
        return true;
    }
}
