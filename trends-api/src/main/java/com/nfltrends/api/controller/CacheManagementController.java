package com.nfltrends.api.controller;

import com.nfltrends.api.dto.CacheStatsResponse;
import com.nfltrends.api.dto.MessageResponse;
import com.nfltrends.api.dto.ProtectedEntriesResponse;
import com.nfltrends.api.service.CacheManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/cache")
@Tag(name = "Cache", description = "Inspect and clear result caches")
public class CacheManagementController {

    private final CacheManagementService cacheManagementService;

    public CacheManagementController(CacheManagementService cacheManagementService) {
        this.cacheManagementService = cacheManagementService;
    }

    @GetMapping("/stats")
    @Operation(summary = "Cache statistics")
    public CacheStatsResponse stats() {
        return cacheManagementService.stats();
    }

    // ============ CLEAR ============

    @PostMapping("/clear/upcoming-games")
    @Operation(summary = "Clear upcoming games cache")
    public MessageResponse clearUpcomingGames(
            @RequestParam(name = "preserve_default", defaultValue = "true") boolean preserveDefault
    ) {
        return cacheManagementService.clearUpcomingGames(preserveDefault);
    }

    @PostMapping("/clear/weekly-trends")
    @Operation(summary = "Clear weekly trends cache")
    public MessageResponse clearWeeklyTrends(
            @RequestParam(name = "preserve_initial", defaultValue = "true") boolean preserveInitial
    ) {
        return cacheManagementService.clearWeeklyTrends(preserveInitial);
    }

    @PostMapping("/clear/all")
    @Operation(summary = "Clear all caches")
    public MessageResponse clearAll(
            @RequestParam(name = "preserve_protected", defaultValue = "true") boolean preserveProtected
    ) {
        return cacheManagementService.clearAll(preserveProtected);
    }

    // ============ PROTECTED ENTRIES ============

    @GetMapping("/protected-entries")
    @Operation(summary = "Protected entries", description = "Whether each pinned entry is present and how many records it holds")
    public ProtectedEntriesResponse protectedEntries() {
        return cacheManagementService.protectedEntries();
    }
}
