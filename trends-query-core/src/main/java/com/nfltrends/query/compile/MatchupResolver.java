package com.nfltrends.query.compile;

import com.nfltrends.query.predicate.And;
import com.nfltrends.query.predicate.Or;
import com.nfltrends.query.predicate.Predicate;

import java.util.List;
import java.util.Optional;

import static com.nfltrends.query.compile.RangeResolver.membership;

/**
 * Resolves a pair of side-specific team filters (home/away, winner/loser) into one predicate.
 * <ul>
 *   <li>the same single team on both sides: that team on either side</li>
 *   <li>two different single teams: exactly that direction</li>
 *   <li>anything else: any pairing of the two sets, in either direction</li>
 * </ul>
 * When only one side is given it is an ordinary membership on that column.
 */
public class MatchupResolver {

    public Optional<Predicate> resolve(String firstColumn, List<Object> first, String secondColumn, List<Object> second) {
        boolean hasFirst = first != null && !first.isEmpty();
        boolean hasSecond = second != null && !second.isEmpty();
        if (!hasFirst && !hasSecond) {
            return Optional.empty();
        }
        if (!hasSecond) {
            return Optional.of(membership(firstColumn, first));
        }
        if (!hasFirst) {
            return Optional.of(membership(secondColumn, second));
        }

        if (first.size() == 1 && second.size() == 1) {
            if (first.equals(second)) {
                return Optional.of(Or.of(membership(firstColumn, first), membership(secondColumn, first)));
            }
            return Optional.of(And.of(membership(firstColumn, first), membership(secondColumn, second)));
        }
        Predicate forward = And.of(membership(firstColumn, first), membership(secondColumn, second));
        Predicate swapped = And.of(membership(firstColumn, second), membership(secondColumn, first));
        return Optional.of(Or.of(forward, swapped));
    }
}
