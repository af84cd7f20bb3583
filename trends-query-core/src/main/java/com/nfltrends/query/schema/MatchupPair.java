package com.nfltrends.query.schema;

/**
 * Two fields describing the two sides of a game (home/away, winner/loser) that are resolved
 * together rather than as independent conjuncts.
 */
public record MatchupPair(String first, String second) {

    public boolean involves(String field) {
        return first.equals(field) || second.equals(field);
    }
}
