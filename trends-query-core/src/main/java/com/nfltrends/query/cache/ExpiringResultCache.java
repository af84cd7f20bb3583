package com.nfltrends.query.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Small cache whose entries expire a fixed interval after they were written. Expiry is checked
 * lazily on access; maintenance runs on the calling thread. Protected entries weigh nothing and
 * are therefore never evicted for capacity, but they still expire.
 */
public class ExpiringResultCache<V> extends AbstractResultCache<V> {

    private final long maxSize;
    private final Duration ttl;
    private final Cache<String, V> entries;

    public ExpiringResultCache(long maxSize, Duration ttl, Set<String> protectedKeys, Ticker ticker) {
        super(protectedKeys);
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.entries = Caffeine.newBuilder()
                .maximumWeight(maxSize)
                .weigher((String key, V value) -> isProtected(key) ? 0 : 1)
                .expireAfterWrite(ttl)
                .executor(Runnable::run)
                .ticker(ticker)
                .build();
    }

    public ExpiringResultCache(long maxSize, Duration ttl, Set<String> protectedKeys) {
        this(maxSize, ttl, protectedKeys, Ticker.systemTicker());
    }

    @Override
    protected V doGet(String key) {
        return entries.getIfPresent(key);
    }

    @Override
    protected boolean doContains(String key) {
        return entries.asMap().containsKey(key);
    }

    @Override
    protected void doPut(String key, V value) {
        entries.put(key, value);
    }

    @Override
    protected void doClear() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    @Override
    protected CacheStats doStats() {
        entries.cleanUp();
        List<String> keys = new ArrayList<>(entries.asMap().keySet());
        return new CacheStats("TTLCache", maxSize, keys.size(), ttl.getSeconds(), keys);
    }
}
