package com.nfltrends.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "trends.cache")
public class TrendsCacheProperties {

    private UpcomingGames upcomingGames = new UpcomingGames();
    private WeeklyTrends weeklyTrends = new WeeklyTrends();

    /**
     * Load upcoming games and the initial weekly trends query once the application is ready.
     */
    private boolean warmUpEnabled = true;

    public UpcomingGames getUpcomingGames() {
        return upcomingGames;
    }

    public void setUpcomingGames(UpcomingGames upcomingGames) {
        this.upcomingGames = upcomingGames;
    }

    public WeeklyTrends getWeeklyTrends() {
        return weeklyTrends;
    }

    public void setWeeklyTrends(WeeklyTrends weeklyTrends) {
        this.weeklyTrends = weeklyTrends;
    }

    public boolean isWarmUpEnabled() {
        return warmUpEnabled;
    }

    public void setWarmUpEnabled(boolean warmUpEnabled) {
        this.warmUpEnabled = warmUpEnabled;
    }

    public static class UpcomingGames {

        private int maxSize = 16;
        private Duration ttl = Duration.ofHours(1);

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class WeeklyTrends {

        private int maxSize = 100;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }
    }
}
