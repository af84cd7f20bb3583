package com.nfltrends.api.service;

import com.nfltrends.api.dto.UpcomingGamesResponse;
import com.nfltrends.api.model.UpcomingGameDocument;
import com.nfltrends.api.repository.UpcomingGameReadRepository;
import com.nfltrends.query.cache.CacheKeys;
import com.nfltrends.query.cache.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The upcoming games snapshot, held in the singleton TTL cache.
 */
@Service
public class UpcomingGameService {

    private static final Logger log = LoggerFactory.getLogger(UpcomingGameService.class);

    private final UpcomingGameReadRepository upcomingGameRepository;
    private final ResultCache<UpcomingGamesResponse> upcomingGamesCache;

    public UpcomingGameService(
            UpcomingGameReadRepository upcomingGameRepository,
            ResultCache<UpcomingGamesResponse> upcomingGamesCache
    ) {
        this.upcomingGameRepository = upcomingGameRepository;
        this.upcomingGamesCache = upcomingGamesCache;
    }

    public UpcomingGamesResponse getUpcomingGames() {
        Optional<UpcomingGamesResponse> cached = upcomingGamesCache.get(CacheKeys.UPCOMING_GAMES);
        if (cached.isPresent()) {
            log.debug("Upcoming games cache hit");
            return cached.get();
        }
        return refresh();
    }

    /**
     * Reloads the snapshot from the store and replaces the cached entry.
     */
    public UpcomingGamesResponse refresh() {
        UpcomingGamesResponse response = new UpcomingGamesResponse(upcomingGameRepository.findAllByOrderByDateAscIdStringAsc());
        upcomingGamesCache.put(CacheKeys.UPCOMING_GAMES, response);
        log.info("Loaded {} upcoming games", response.totalCount());
        return response;
    }

    /**
     * Matchup strings ({@code HOMEvsAWAY}) for games with both abbreviations known.
     */
    public static List<String> matchupStrings(List<UpcomingGameDocument> games) {
        List<String> matchups = new ArrayList<>();
        for (UpcomingGameDocument game : games) {
            if (game.getHomeAbbreviation() == null || game.getAwayAbbreviation() == null) {
                continue;
            }
            String matchup = game.getHomeAbbreviation() + "vs" + game.getAwayAbbreviation();
            if (!matchups.contains(matchup)) {
                matchups.add(matchup);
            }
        }
        return matchups;
    }
}
