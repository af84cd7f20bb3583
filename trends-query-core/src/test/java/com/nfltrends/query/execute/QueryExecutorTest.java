package com.nfltrends.query.execute;

import com.nfltrends.query.compile.CompiledQuery;
import com.nfltrends.query.compile.QueryCompiler;
import com.nfltrends.query.predicate.Predicate;
import com.nfltrends.query.schema.FilterSchemas;
import com.nfltrends.query.sort.SortSpec;
import com.nfltrends.query.support.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.nfltrends.query.support.Rows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryExecutorTest {

    @Mock
    private RecordStore<Map<String, Object>> mockStore;

    private QueryExecutor executor;
    private QueryCompiler compiler;
    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        executor = new QueryExecutor();
        compiler = new QueryCompiler();
        List<Map<String, Object>> games = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            games.add(row("id_string", "DALNYG2024" + String.format("%04d", i),
                    "date", "2024-09-" + String.format("%02d", i),
                    "home_team", i % 2 == 0 ? "Dallas Cowboys" : "New York Giants",
                    "home_score", i));
        }
        store = new InMemoryRecordStore(games);
    }

    private CompiledQuery games(Map<String, ?> body) {
        return compiler.compile(FilterSchemas.GAMES, body);
    }

    @Test
    void totalCountIgnoresPagination() {
        PagedResult<Map<String, Object>> one = executor.execute(store, games(Map.of("home_team", "Dallas Cowboys", "limit", 1)));
        PagedResult<Map<String, Object>> hundred = executor.execute(store, games(Map.of("home_team", "Dallas Cowboys", "limit", 100)));

        assertThat(one.totalCount()).isEqualTo(6).isEqualTo(hundred.totalCount());
        assertThat(one.count()).isEqualTo(1);
        assertThat(hundred.count()).isEqualTo(6);
    }

    @Test
    void offsetAndLimitAreEchoed() {
        PagedResult<Map<String, Object>> page = executor.execute(store, games(Map.of("limit", 5, "offset", 10)));

        assertThat(page.limit()).isEqualTo(5);
        assertThat(page.offset()).isEqualTo(10);
        assertThat(page.count()).isEqualTo(2);
        assertThat(page.totalCount()).isEqualTo(12);
        assertThat(page.results()).extracting(r -> r.get("date")).containsExactly("2024-09-11", "2024-09-12");
    }

    @Test
    void noMatchesIsAnEmptyPage() {
        PagedResult<Map<String, Object>> page = executor.execute(store, games(Map.of("home_team", "Buffalo Bills")));

        assertThat(page.results()).isEmpty();
        assertThat(page.count()).isZero();
        assertThat(page.totalCount()).isZero();
        assertThat(store.findCalls()).isZero();
    }

    @Test
    void storeFailurePropagates() {
        when(mockStore.count(any(Predicate.class))).thenReturn(3L);
        when(mockStore.find(any(Predicate.class), any(SortSpec.class), anyInt(), anyInt()))
                .thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> executor.execute(mockStore, games(Map.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("connection reset");
    }

    @Test
    void countUsesPredicateOnly() {
        when(mockStore.count(any(Predicate.class))).thenReturn(0L);

        executor.execute(mockStore, games(Map.of("sort_by", "home_score", "limit", 3)));

        verify(mockStore, never()).find(any(), any(), anyInt(), anyInt());
    }
}
