package com.nfltrends.query.schema;

import java.util.ArrayList;
import java.util.List;

public enum TrendCategory {

    HOME_ATS("home ats"),
    HOME_OUTRIGHT("home outright"),
    AWAY_ATS("away ats"),
    AWAY_OUTRIGHT("away outright"),
    FAVORITE_ATS("favorite ats"),
    FAVORITE_OUTRIGHT("favorite outright"),
    UNDERDOG_ATS("underdog ats"),
    UNDERDOG_OUTRIGHT("underdog outright"),
    HOME_FAVORITE_ATS("home favorite ats"),
    HOME_FAVORITE_OUTRIGHT("home favorite outright"),
    AWAY_UNDERDOG_ATS("away underdog ats"),
    AWAY_UNDERDOG_OUTRIGHT("away underdog outright"),
    AWAY_FAVORITE_ATS("away favorite ats"),
    AWAY_FAVORITE_OUTRIGHT("away favorite outright"),
    HOME_UNDERDOG_ATS("home underdog ats"),
    HOME_UNDERDOG_OUTRIGHT("home underdog outright"),
    OVER("over"),
    UNDER("under");

    private final String label;

    TrendCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static List<String> labels() {
        List<String> labels = new ArrayList<>();
        for (TrendCategory category : values()) {
            labels.add(category.label);
        }
        return labels;
    }
}
