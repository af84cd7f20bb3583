package com.nfltrends.query.filter;

import java.util.Locale;

public enum MatchMode {

    CONTAINS_ANY,
    CONTAINS_ALL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MatchMode fromWireName(String value) {
        for (MatchMode mode : values()) {
            if (mode.wireName().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new FilterValidationException("games_applicable.match_mode",
                "Invalid match_mode: " + value, "contains_any or contains_all");
    }
}
