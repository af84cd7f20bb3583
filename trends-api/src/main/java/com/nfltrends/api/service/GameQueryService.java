package com.nfltrends.api.service;

import com.nfltrends.api.model.GameDocument;
import com.nfltrends.query.compile.CompiledQuery;
import com.nfltrends.query.compile.QueryCompiler;
import com.nfltrends.query.execute.PagedResult;
import com.nfltrends.query.execute.QueryExecutor;
import com.nfltrends.query.execute.RecordStore;
import com.nfltrends.query.schema.FilterSchemas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Filtered queries over historical games.
 */
@Service
public class GameQueryService {

    private static final Logger log = LoggerFactory.getLogger(GameQueryService.class);

    private final QueryCompiler queryCompiler;
    private final QueryExecutor queryExecutor;
    private final RecordStore<GameDocument> gameStore;

    public GameQueryService(QueryCompiler queryCompiler, QueryExecutor queryExecutor, RecordStore<GameDocument> gameStore) {
        this.queryCompiler = queryCompiler;
        this.queryExecutor = queryExecutor;
        this.gameStore = gameStore;
    }

    public PagedResult<GameDocument> findGames(Map<String, ?> body) {
        CompiledQuery query = queryCompiler.compile(FilterSchemas.GAMES, body);
        log.debug("Games query: {}", query.predicate());
        return queryExecutor.execute(gameStore, query);
    }
}
