package com.nfltrends.api.controller;

import com.nfltrends.api.model.GameDocument;
import com.nfltrends.api.service.GameQueryService;
import com.nfltrends.query.execute.PagedResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/games")
@Tag(name = "Games", description = "Filtered queries over historical games")
public class GameController {

    private final GameQueryService gameQueryService;

    public GameController(GameQueryService gameQueryService) {
        this.gameQueryService = gameQueryService;
    }

    @PostMapping
    @Operation(summary = "Query games",
            description = "Filter, sort and paginate historical games. Unknown keys and out-of-domain values are rejected with 400.")
    public PagedResult<GameDocument> queryGames(@RequestBody(required = false) Map<String, Object> body) {
        return gameQueryService.findGames(body == null ? Map.of() : body);
    }
}
