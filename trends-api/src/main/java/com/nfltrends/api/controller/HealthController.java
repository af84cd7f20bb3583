package com.nfltrends.api.controller;

import com.nfltrends.api.repository.GameReadRepository;
import com.nfltrends.api.repository.TrendReadRepository;
import com.nfltrends.api.repository.UpcomingGameReadRepository;
import com.nfltrends.api.repository.WeeklyTrendReadRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final Map<String, MongoRepository<?, String>> repositories = new LinkedHashMap<>();

    public HealthController(
            GameReadRepository gameRepository,
            TrendReadRepository trendRepository,
            WeeklyTrendReadRepository weeklyTrendRepository,
            UpcomingGameReadRepository upcomingGameRepository
    ) {
        repositories.put("games", gameRepository);
        repositories.put("trends", trendRepository);
        repositories.put("weeklyTrends", weeklyTrendRepository);
        repositories.put("upcomingGames", upcomingGameRepository);
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API and database connectivity")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());

        for (Map.Entry<String, MongoRepository<?, String>> entry : repositories.entrySet()) {
            try {
                health.put(entry.getKey() + "Count", entry.getValue().count());
            } catch (Exception e) {
                health.put("status", "DEGRADED");
                health.put(entry.getKey() + "Count", "ERROR: " + e.getMessage());
            }
        }
        return health;
    }
}
