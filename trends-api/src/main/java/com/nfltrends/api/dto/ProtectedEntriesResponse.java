package com.nfltrends.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProtectedEntriesResponse(
        @JsonProperty("upcoming_games_default") Entry upcomingGamesDefault,
        @JsonProperty("initial_weekly_trends") Entry initialWeeklyTrends
) {

    /**
     * Presence of one protected entry and the number of records it holds.
     */
    public record Entry(
            @JsonProperty("exists") boolean exists,
            @JsonProperty("record_count") long recordCount
    ) {
    }
}
