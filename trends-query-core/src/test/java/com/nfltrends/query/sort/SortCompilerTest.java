package com.nfltrends.query.sort;

import com.nfltrends.query.filter.FilterValidationException;
import com.nfltrends.query.ordinal.CategoricalOrdinal;
import com.nfltrends.query.predicate.And;
import com.nfltrends.query.schema.FilterSchemas;
import com.nfltrends.query.support.InMemoryRecordStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.nfltrends.query.support.Rows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SortCompilerTest {

    private final SortCompiler compiler = new SortCompiler();

    @Test
    void absentOrEmptyUsesTheDefault() {
        assertThat(compiler.compile(FilterSchemas.GAMES, null))
                .isEqualTo(SortSpec.of(SortKey.asc("date"), SortKey.asc("id_string")));
        assertThat(compiler.compile(FilterSchemas.TRENDS, List.of()))
                .isEqualTo(SortSpec.of(SortKey.desc("win_percentage"), SortKey.desc("total_games")));
        assertThat(compiler.compile(FilterSchemas.TRENDS, ""))
                .isEqualTo(FilterSchemas.TRENDS.defaultSort());
        assertThat(compiler.compile(FilterSchemas.GAMES, Map.of()))
                .isEqualTo(FilterSchemas.GAMES.defaultSort());
    }

    @Test
    void acceptsStringObjectAndMixedList() {
        assertThat(compiler.compile(FilterSchemas.GAMES, "year")).isEqualTo(SortSpec.of(SortKey.asc("year")));
        assertThat(compiler.compile(FilterSchemas.GAMES, Map.of("field", "year", "order", "desc")))
                .isEqualTo(SortSpec.of(SortKey.desc("year")));
        assertThat(compiler.compile(FilterSchemas.GAMES, List.of("season", Map.of("field", "home_team"))))
                .isEqualTo(SortSpec.of(SortKey.asc("season"), SortKey.asc("home_team")));
    }

    @Test
    void categoricalColumnsCarryTheirOrdinalTable() {
        SortSpec sort = compiler.compile(FilterSchemas.GAMES, List.of("month", "day_of_week", "year"));

        assertThat(sort.keys()).extracting(SortKey::ordinal)
                .containsExactly(CategoricalOrdinal.MONTHS, CategoricalOrdinal.WEEKDAYS, null);
        assertThat(sort.hasCategoricalKeys()).isTrue();
    }

    @Test
    void unknownFieldIsRejectedByName() {
        assertThatThrownBy(() -> compiler.compile(FilterSchemas.GAMES, List.of("date", "colour")))
                .isInstanceOf(FilterValidationException.class)
                .hasMessageContaining("colour");
    }

    @Test
    void invalidOrderOrShapeIsRejected() {
        assertThatThrownBy(() -> compiler.compile(FilterSchemas.GAMES, Map.of("field", "date", "order", "up")))
                .isInstanceOf(FilterValidationException.class);
        assertThatThrownBy(() -> compiler.compile(FilterSchemas.GAMES, Map.of("order", "asc")))
                .isInstanceOf(FilterValidationException.class);
        assertThatThrownBy(() -> compiler.compile(FilterSchemas.GAMES, 42))
                .isInstanceOf(FilterValidationException.class);
    }

    @Test
    void monthsSortByCalendarWithNullsAfterRealValues() {
        InMemoryRecordStore store = new InMemoryRecordStore(List.of(
                row("month", "October"), row("month", null), row("month", "January"), row("month", "September")));

        SortSpec ascending = compiler.compile(FilterSchemas.TRENDS, "month");
        SortSpec descending = compiler.compile(FilterSchemas.TRENDS, Map.of("field", "month", "order", "desc"));

        assertThat(months(store, ascending)).containsExactly("January", "September", "October", null);
        assertThat(months(store, descending)).containsExactly(null, "October", "September", "January");
    }

    private static List<Object> months(InMemoryRecordStore store, SortSpec sort) {
        return store.find(And.of(), sort, 10, 0).stream()
                .map(row -> row.get("month"))
                .collect(Collectors.toList());
    }
}
