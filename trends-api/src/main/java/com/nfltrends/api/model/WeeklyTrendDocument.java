package com.nfltrends.api.model;

import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;

/**
 * Trend recomputed for the current week, tagged with the upcoming games it applies to.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "weekly_trends")
public class WeeklyTrendDocument extends BaseTrendDocument {

    @Field("games_applicable")
    private List<String> gamesApplicable;

    public List<String> getGamesApplicable() { return gamesApplicable; }
}
