package com.nfltrends.query.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LruResultCacheTest {

    private static final String PINNED = CacheKeys.INITIAL_WEEKLY_TRENDS;

    private LruResultCache<String> cache;

    @BeforeEach
    void setUp() {
        cache = new LruResultCache<>(3, Set.of(PINNED));
    }

    @Test
    void putThenGet() {
        cache.put("a", "result-a");

        assertThat(cache.get("a")).contains("result-a");
        assertThat(cache.containsKey("a")).isTrue();
        assertThat(cache.get("missing")).isEmpty();
    }

    @Test
    void clearPreservingProtectedKeepsOnlyPinnedEntries() {
        cache.put(PINNED, "initial");
        cache.put("a", "result-a");

        cache.clear(true);

        assertThat(cache.get(PINNED)).contains("initial");
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void clearWithoutPreservingRemovesPinnedEntries() {
        cache.put(PINNED, "initial");
        cache.put("a", "result-a");

        cache.clear(false);

        assertThat(cache.get(PINNED)).isEmpty();
        assertThat(cache.stats().currentSize()).isZero();
    }

    @Test
    void clearPreservingWithoutPinnedEntryLeavesCacheEmpty() {
        cache.put("a", "result-a");

        cache.clear(true);

        assertThat(cache.stats().keys()).isEmpty();
    }

    @Test
    void evictsLeastRecentlyUsed() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.get("a");

        cache.put("d", "4");

        assertThat(cache.containsKey("b")).isFalse();
        assertThat(cache.stats().keys()).containsExactlyInAnyOrder("a", "c", "d");
    }

    @Test
    void presenceCheckDoesNotRefreshRecency() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        assertThat(cache.containsKey("a")).isTrue();

        cache.put("d", "4");

        assertThat(cache.stats().keys()).containsExactlyInAnyOrder("b", "c", "d");
    }

    @Test
    void pinnedEntryIsNeverEvictedForCapacity() {
        cache.put(PINNED, "initial");
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.put("d", "4");

        assertThat(cache.get(PINNED)).contains("initial");
        assertThat(cache.stats().currentSize()).isEqualTo(3);
    }

    @Test
    void statsDescribeTheCache() {
        cache.put("a", "1");

        CacheStats stats = cache.stats();

        assertThat(stats.type()).isEqualTo("LRUCache");
        assertThat(stats.maxSize()).isEqualTo(3);
        assertThat(stats.currentSize()).isEqualTo(1);
        assertThat(stats.ttlSeconds()).isNull();
        assertThat(stats.keys()).containsExactly("a");
    }
}
