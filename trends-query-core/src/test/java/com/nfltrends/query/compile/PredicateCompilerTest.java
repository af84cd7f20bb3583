package com.nfltrends.query.compile;

import com.nfltrends.query.filter.FilterDocument;
import com.nfltrends.query.filter.FilterNormalizer;
import com.nfltrends.query.filter.ValueSet;
import com.nfltrends.query.predicate.And;
import com.nfltrends.query.predicate.Equals;
import com.nfltrends.query.predicate.Or;
import com.nfltrends.query.schema.FilterSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.nfltrends.query.support.PredicateEvaluator.matches;
import static com.nfltrends.query.support.Rows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PredicateCompilerTest {

    private FilterNormalizer normalizer;
    private PredicateCompiler compiler;

    @BeforeEach
    void setUp() {
        normalizer = new FilterNormalizer();
        compiler = new PredicateCompiler();
    }

    private And compileGames(Map<String, ?> body) {
        return compiler.compile(FilterSchemas.GAMES, normalizer.normalize(FilterSchemas.GAMES, body).filter());
    }

    @Test
    void emptyFilterMatchesEverything() {
        And predicate = compileGames(Map.of());

        assertThat(predicate.isEmpty()).isTrue();
        assertThat(matches(predicate, row("home_team", "Dallas Cowboys"))).isTrue();
    }

    @Test
    void compilingTwiceGivesEqualTrees() {
        Map<String, Object> body = Map.of(
                "home_team", List.of("Dallas Cowboys", "New York Giants"),
                "away_team", "Philadelphia Eagles",
                "start_month", "September",
                "spread", List.of(3, 7.5),
                "divisional", true);

        assertThat(compileGames(body)).isEqualTo(compileGames(body));
    }

    @Test
    void fieldOrderDoesNotChangeTheTree() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("year", List.of(2012, 2010));
        first.put("home_division", "NFC East");
        first.put("over_hit", true);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("over_hit", true);
        second.put("home_division", "nfc east");
        second.put("year", List.of(2010, 2012));

        assertThat(compileGames(first)).isEqualTo(compileGames(second));
    }

    @Test
    void flagsCompileToEquality() {
        assertThat(compileGames(Map.of("favorite_cover", false)))
                .isEqualTo(And.of(new Equals("favorite_cover", false)));
    }

    @Test
    void divisionsAreIndependentConjuncts() {
        And predicate = compileGames(Map.of("home_division", "AFC West", "away_division", "NFC East"));

        assertThat(matches(predicate, row("home_division", "AFC West", "away_division", "NFC East"))).isTrue();
        assertThat(matches(predicate, row("home_division", "NFC East", "away_division", "AFC West"))).isFalse();
    }

    @Test
    void abbreviationsUseMatchupResolution() {
        And predicate = compileGames(Map.of("home_abbreviation", "DAL", "away_abbreviation", "DAL"));

        assertThat(predicate).isEqualTo(And.of(Or.of(
                new Equals("home_abbreviation", "DAL"), new Equals("away_abbreviation", "DAL"))));
    }

    @Test
    void winnerAndLoserUseMatchupResolution() {
        And predicate = compileGames(Map.of("winner", "Dallas Cowboys", "loser", "New York Giants"));

        assertThat(matches(predicate, row("winner", "Dallas Cowboys", "loser", "New York Giants"))).isTrue();
        assertThat(matches(predicate, row("winner", "New York Giants", "loser", "Dallas Cowboys"))).isFalse();
    }

    @Test
    void gameIdFiltersTheStoredIdColumn() {
        assertThat(compileGames(Map.of("game_id", "dalnyg20240908")))
                .isEqualTo(And.of(new Equals("id_string", "DALNYG20240908")));
    }

    @Test
    void derivedColumnsAreFilteredAsStored() {
        And predicate = compileGames(Map.of("min_home_spread_result", -3, "max_home_spread_result", 3));

        assertThat(matches(predicate, row("home_spread_result", -3))).isTrue();
        assertThat(matches(predicate, row("home_spread_result", 4))).isFalse();
    }

    @Test
    void matchupSideHoldingNullSentinelIsAnInvariantViolation() {
        FilterDocument document = FilterDocument.builder()
                .put("home_team", new ValueSet(List.of("Dallas Cowboys"), true))
                .build();

        assertThatThrownBy(() -> compiler.compile(FilterSchemas.GAMES, document))
                .isInstanceOf(PredicateCompilationException.class);
    }
}
