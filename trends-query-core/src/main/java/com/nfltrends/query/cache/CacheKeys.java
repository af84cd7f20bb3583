package com.nfltrends.query.cache;

import java.util.Set;

/**
 * Fixed keys of the two always-present canonical queries. Content fingerprints never take
 * these values.
 */
public final class CacheKeys {

    /** The parameterless upcoming games listing. */
    public static final String UPCOMING_GAMES = "upcoming_games_empty_body";

    /** The weekly trends query computed at startup from the upcoming games snapshot. */
    public static final String INITIAL_WEEKLY_TRENDS = "0d0aeea50e84aae522b2f54ed54f14cd9f9b651b6cb50dd6aa873441282851e9";

    public static final Set<String> RESERVED = Set.of(UPCOMING_GAMES, INITIAL_WEEKLY_TRENDS);

    private CacheKeys() {
    }
}
