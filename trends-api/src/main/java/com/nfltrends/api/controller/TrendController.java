package com.nfltrends.api.controller;

import com.nfltrends.api.model.TrendDocument;
import com.nfltrends.api.service.TrendQueryService;
import com.nfltrends.query.execute.PagedResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/trends")
@Tag(name = "Trends", description = "Filtered queries over aggregated betting trends")
public class TrendController {

    private final TrendQueryService trendQueryService;

    public TrendController(TrendQueryService trendQueryService) {
        this.trendQueryService = trendQueryService;
    }

    @PostMapping
    @Operation(summary = "Query trends", description = "Default sort is win_percentage desc, total_games desc")
    public PagedResult<TrendDocument> queryTrends(@RequestBody(required = false) Map<String, Object> body) {
        return trendQueryService.findTrends(body == null ? Map.of() : body);
    }
}
