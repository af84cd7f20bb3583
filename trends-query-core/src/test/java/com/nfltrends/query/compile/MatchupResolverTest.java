package com.nfltrends.query.compile;

import com.nfltrends.query.predicate.And;
import com.nfltrends.query.predicate.Equals;
import com.nfltrends.query.predicate.In;
import com.nfltrends.query.predicate.Or;
import com.nfltrends.query.predicate.Predicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.nfltrends.query.support.PredicateEvaluator.matches;
import static com.nfltrends.query.support.Rows.row;
import static org.assertj.core.api.Assertions.assertThat;

class MatchupResolverTest {

    private final MatchupResolver resolver = new MatchupResolver();

    private Predicate resolve(List<Object> home, List<Object> away) {
        return resolver.resolve("home_team", home, "away_team", away).orElseThrow();
    }

    @Test
    @DisplayName("the same team on both sides matches that team playing either side")
    void sameSingleTeamOnBothSides() {
        Predicate predicate = resolve(List.of("A"), List.of("A"));

        assertThat(predicate).isEqualTo(Or.of(new Equals("home_team", "A"), new Equals("away_team", "A")));
        assertThat(matches(predicate, row("home_team", "C", "away_team", "A"))).isTrue();
        assertThat(matches(predicate, row("home_team", "A", "away_team", "C"))).isTrue();
        assertThat(matches(predicate, row("home_team", "B", "away_team", "C"))).isFalse();
    }

    @Test
    @DisplayName("two distinct single teams match only that direction")
    void exactDirectionalMatch() {
        Predicate predicate = resolve(List.of("A"), List.of("B"));

        assertThat(predicate).isEqualTo(And.of(new Equals("home_team", "A"), new Equals("away_team", "B")));
        assertThat(matches(predicate, row("home_team", "A", "away_team", "B"))).isTrue();
        assertThat(matches(predicate, row("home_team", "B", "away_team", "A"))).isFalse();
    }

    @Test
    @DisplayName("equal multi-team sets match any pairing of those teams")
    void equalMultiTeamSets() {
        Predicate predicate = resolve(List.of("A", "B"), List.of("A", "B"));

        assertThat(matches(predicate, row("home_team", "A", "away_team", "B"))).isTrue();
        assertThat(matches(predicate, row("home_team", "B", "away_team", "A"))).isTrue();
        assertThat(matches(predicate, row("home_team", "A", "away_team", "C"))).isFalse();
    }

    @Test
    @DisplayName("asymmetric sets match forward or swapped pairings")
    void asymmetricSets() {
        Predicate predicate = resolve(List.of("A", "B"), List.of("C"));

        assertThat(predicate).isEqualTo(Or.of(
                And.of(new In("home_team", List.of("A", "B")), new Equals("away_team", "C")),
                And.of(new Equals("home_team", "C"), new In("away_team", List.of("A", "B")))));
        assertThat(matches(predicate, row("home_team", "B", "away_team", "C"))).isTrue();
        assertThat(matches(predicate, row("home_team", "C", "away_team", "A"))).isTrue();
        assertThat(matches(predicate, row("home_team", "A", "away_team", "B"))).isFalse();
    }

    @Test
    void oneSideOnlyIsPlainMembership() {
        assertThat(resolver.resolve("home_team", List.of("A", "B"), "away_team", null))
                .contains(new In("home_team", List.of("A", "B")));
        assertThat(resolver.resolve("home_team", null, "away_team", List.of("C")))
                .contains(new Equals("away_team", "C"));
    }

    @Test
    void nothingOnEitherSide() {
        assertThat(resolver.resolve("home_team", null, "away_team", List.of())).isEmpty();
    }
}
