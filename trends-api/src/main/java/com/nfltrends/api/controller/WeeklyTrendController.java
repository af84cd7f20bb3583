package com.nfltrends.api.controller;

import com.nfltrends.api.model.WeeklyTrendDocument;
import com.nfltrends.api.service.WeeklyTrendQueryService;
import com.nfltrends.query.execute.PagedResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/weekly-trends")
@Tag(name = "Weekly Trends", description = "Trends applicable to this week's games, cached")
public class WeeklyTrendController {

    private final WeeklyTrendQueryService weeklyTrendQueryService;

    public WeeklyTrendController(WeeklyTrendQueryService weeklyTrendQueryService) {
        this.weeklyTrendQueryService = weeklyTrendQueryService;
    }

    @PostMapping
    @Operation(summary = "Query weekly trends",
            description = "Accepts all trend filters plus games_applicable {games, match_mode}. Results are cached by query fingerprint.")
    public PagedResult<WeeklyTrendDocument> queryWeeklyTrends(@RequestBody(required = false) Map<String, Object> body) {
        return weeklyTrendQueryService.findWeeklyTrends(body == null ? Map.of() : body);
    }
}
