package com.nfltrends.api.service;

import com.nfltrends.api.config.TrendsCacheProperties;
import com.nfltrends.api.dto.UpcomingGamesResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheWarmupServiceTest {

    @Mock
    private UpcomingGameService upcomingGameService;

    @Mock
    private WeeklyTrendQueryService weeklyTrendQueryService;

    private final TrendsCacheProperties properties = new TrendsCacheProperties();

    @Test
    void upcomingGamesFailureDoesNotStopStartup() {
        CacheWarmupService warmup = new CacheWarmupService(properties, upcomingGameService, weeklyTrendQueryService);
        when(upcomingGameService.refresh()).thenThrow(new IllegalStateException("mongo unavailable"));

        assertThat(warmup.warmUp()).isFalse();
        verifyNoInteractions(weeklyTrendQueryService);
    }

    @Test
    void noMatchupsSkipsInitialQuery() {
        CacheWarmupService warmup = new CacheWarmupService(properties, upcomingGameService, weeklyTrendQueryService);
        when(upcomingGameService.refresh()).thenReturn(new UpcomingGamesResponse(List.of()));

        assertThat(warmup.warmUp()).isFalse();
        verify(weeklyTrendQueryService, never()).warmInitialQuery(anyList());
    }

    @Test
    void disabledWarmUpDoesNothing() {
        properties.setWarmUpEnabled(false);
        CacheWarmupService warmup = new CacheWarmupService(properties, upcomingGameService, weeklyTrendQueryService);

        warmup.onApplicationReady();

        verifyNoInteractions(upcomingGameService, weeklyTrendQueryService);
    }
}
