package com.nfltrends.api.service;

import com.nfltrends.query.ordinal.CategoricalOrdinal;
import com.nfltrends.query.schema.TrendCategory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body of the weekly trends query computed at startup for the current slate of games.
 */
public final class InitialWeeklyTrendsQuery {

    static final int LIMIT = 5000;

    private InitialWeeklyTrendsQuery() {
    }

    public static Map<String, Object> body(List<String> games) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", TrendCategory.labels());
        body.put("month", List.of("September", "None"));
        body.put("day_of_week", List.of("Sunday", "Monday", "Thursday", "Friday", "None"));

        Map<String, Object> spread = new LinkedHashMap<>();
        spread.put("exact", List.of("None", "1.5", "2.5", "3.0", "3.5", "5.5", "6.5", "7.5", "8.5"));
        spread.put("or_less", range(2, 14, 1));
        spread.put("or_more", range(1, 8, 1));
        body.put("spread", spread);

        Map<String, Object> total = new LinkedHashMap<>();
        total.put("exact", List.of("None"));
        total.put("or_less", range(40, 60, 5));
        total.put("or_more", range(30, 50, 5));
        body.put("total", total);

        List<String> seasons = new ArrayList<>(CategoricalOrdinal.SEASONS_SINCE.labels());
        seasons.remove("since 2025-2026");
        body.put("seasons", Map.of("exact", seasons));

        body.put("games_applicable", Map.of("games", List.copyOf(games), "match_mode", "contains_any"));
        body.put("limit", LIMIT);
        body.put("offset", 0);
        body.put("sort_by", List.of(
                Map.of("field", "win_percentage", "order", "desc"),
                Map.of("field", "total_games", "order", "desc")));
        return body;
    }

    private static List<Integer> range(int from, int to, int step) {
        List<Integer> values = new ArrayList<>();
        for (int value = from; value <= to; value += step) {
            values.add(value);
        }
        return values;
    }
}
