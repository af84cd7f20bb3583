package com.nfltrends.query.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiringResultCacheTest {

    private static final String PINNED = CacheKeys.UPCOMING_GAMES;

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    private ExpiringResultCache<String> cache;

    @BeforeEach
    void setUp() {
        cache = new ExpiringResultCache<>(16, Duration.ofHours(1), Set.of(PINNED), ticker);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    void entryIsServedWithinTheInterval() {
        cache.put(PINNED, "games");
        advance(Duration.ofMinutes(59));

        assertThat(cache.get(PINNED)).contains("games");
    }

    @Test
    void entryExpiresAfterTheInterval() {
        cache.put(PINNED, "games");
        advance(Duration.ofMinutes(61));

        assertThat(cache.get(PINNED)).isEmpty();
        assertThat(cache.containsKey(PINNED)).isFalse();
    }

    @Test
    void rewritingRestartsTheInterval() {
        cache.put(PINNED, "old");
        advance(Duration.ofMinutes(40));
        cache.put(PINNED, "new");
        advance(Duration.ofMinutes(40));

        assertThat(cache.get(PINNED)).contains("new");
    }

    @Test
    void clearPreservingProtectedKeepsDefaultEntry() {
        cache.put(PINNED, "games");
        cache.put("other", "x");

        cache.clear(true);

        assertThat(cache.get(PINNED)).contains("games");
        assertThat(cache.get("other")).isEmpty();
    }

    @Test
    void clearWithoutPreservingRemovesDefaultEntry() {
        cache.put(PINNED, "games");

        cache.clear(false);

        assertThat(cache.get(PINNED)).isEmpty();
    }

    @Test
    void pinnedEntryIsNeverEvictedForCapacity() {
        cache.put(PINNED, "games");
        for (int i = 0; i < 40; i++) {
            cache.put("query-" + i, "result-" + i);
        }

        assertThat(cache.get(PINNED)).contains("games");
        assertThat(cache.stats().currentSize()).isLessThanOrEqualTo(17);
        assertThat(cache.stats().keys()).contains(PINNED);
    }

    @Test
    void containsKeyRespectsExpiry() {
        cache.put("other", "x");
        assertThat(cache.containsKey("other")).isTrue();

        advance(Duration.ofMinutes(61));

        assertThat(cache.containsKey("other")).isFalse();
    }

    @Test
    void statsReportExpiryInterval() {
        cache.put(PINNED, "games");

        CacheStats stats = cache.stats();

        assertThat(stats.type()).isEqualTo("TTLCache");
        assertThat(stats.maxSize()).isEqualTo(16);
        assertThat(stats.ttlSeconds()).isEqualTo(3600L);
        assertThat(stats.keys()).containsExactly(PINNED);
    }

    @Test
    void statsSkipExpiredEntries() {
        cache.put("other", "x");
        advance(Duration.ofHours(2));

        assertThat(cache.stats().currentSize()).isZero();
    }
}
