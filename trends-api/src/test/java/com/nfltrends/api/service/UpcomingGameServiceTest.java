package com.nfltrends.api.service;

import com.nfltrends.api.dto.UpcomingGamesResponse;
import com.nfltrends.api.model.UpcomingGameDocument;
import com.nfltrends.api.repository.UpcomingGameReadRepository;
import com.nfltrends.query.cache.CacheKeys;
import com.nfltrends.query.cache.ExpiringResultCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UpcomingGameServiceTest {

    @Mock
    private UpcomingGameReadRepository repository;

    private ExpiringResultCache<UpcomingGamesResponse> cache;
    private UpcomingGameService service;

    @BeforeEach
    void setUp() {
        cache = new ExpiringResultCache<>(16, Duration.ofHours(1), Set.of(CacheKeys.UPCOMING_GAMES));
        service = new UpcomingGameService(repository, cache);
    }

    private static UpcomingGameDocument game(String home, String away) {
        UpcomingGameDocument game = mock(UpcomingGameDocument.class);
        lenient().when(game.getHomeAbbreviation()).thenReturn(home);
        lenient().when(game.getAwayAbbreviation()).thenReturn(away);
        return game;
    }

    @Test
    void loadsOnceThenServesFromCache() {
        when(repository.findAllByOrderByDateAscIdStringAsc()).thenReturn(List.of(new UpcomingGameDocument()));

        UpcomingGamesResponse first = service.getUpcomingGames();
        UpcomingGamesResponse second = service.getUpcomingGames();

        assertThat(first.totalCount()).isEqualTo(1);
        assertThat(second).isSameAs(first);
        verify(repository, times(1)).findAllByOrderByDateAscIdStringAsc();
    }

    @Test
    void clearedEntryIsReloaded() {
        when(repository.findAllByOrderByDateAscIdStringAsc()).thenReturn(List.of());

        service.getUpcomingGames();
        cache.clear(false);
        service.getUpcomingGames();

        verify(repository, times(2)).findAllByOrderByDateAscIdStringAsc();
    }

    @Test
    void buildsDistinctHomeVersusAwayStrings() {
        List<UpcomingGameDocument> games = List.of(
                game("PHI", "DAL"),
                game("KC", "BAL"),
                game("PHI", "DAL"),
                game(null, "NYG"));

        assertThat(UpcomingGameService.matchupStrings(games)).containsExactly("PHIvsDAL", "KCvsBAL");
    }
}
