package com.nfltrends.api.controller;

import com.nfltrends.api.dto.UpcomingGamesResponse;
import com.nfltrends.api.service.UpcomingGameService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/upcoming-games")
@Tag(name = "Upcoming Games", description = "Snapshot of the next slate of games")
public class UpcomingGameController {

    private final UpcomingGameService upcomingGameService;

    public UpcomingGameController(UpcomingGameService upcomingGameService) {
        this.upcomingGameService = upcomingGameService;
    }

    @GetMapping
    @Operation(summary = "Get upcoming games", description = "Served from a cache refreshed hourly")
    public UpcomingGamesResponse getUpcomingGames() {
        return upcomingGameService.getUpcomingGames();
    }
}
