package com.nfltrends.query.filter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Restricts weekly trends to those applicable to the given {@code HOMEvsAWAY} games.
 */
public record GamesApplicable(List<String> games, MatchMode mode) implements FieldFilter {

    public GamesApplicable {
        games = List.copyOf(games);
    }

    @Override
    public Object canonical() {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("games", games);
        form.put("match_mode", mode.wireName());
        return form;
    }
}
