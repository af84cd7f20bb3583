package com.nfltrends.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nfltrends.api.model.UpcomingGameDocument;

import java.util.List;

public record UpcomingGamesResponse(
        @JsonProperty("upcoming_games") List<UpcomingGameDocument> upcomingGames,
        @JsonProperty("total_count") int totalCount
) {
    public UpcomingGamesResponse(List<UpcomingGameDocument> upcomingGames) {
        this(List.copyOf(upcomingGames), upcomingGames.size());
    }
}
