package com.nfltrends.query.cache;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Bounded cache with strict least-recently-used eviction. Reads and writes both count as use;
 * {@link #containsKey(String)} does not.
 * When full, the least recently used unprotected entry is evicted.
 */
public class LruResultCache<V> extends AbstractResultCache<V> {

    private final int maxSize;
    private final LinkedHashMap<String, V> entries = new LinkedHashMap<>(16, 0.75f, true);

    public LruResultCache(int maxSize, Set<String> protectedKeys) {
        super(protectedKeys);
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.maxSize = maxSize;
    }

    @Override
    protected V doGet(String key) {
        return entries.get(key);
    }

    @Override
    protected boolean doContains(String key) {
        return entries.containsKey(key);
    }

    @Override
    protected void doPut(String key, V value) {
        entries.put(key, value);
        evictOverflow();
    }

    @Override
    protected void doClear() {
        entries.clear();
    }

    @Override
    protected CacheStats doStats() {
        List<String> keys = new ArrayList<>(entries.keySet());
        return new CacheStats("LRUCache", maxSize, keys.size(), null, keys);
    }

    private void evictOverflow() {
        while (entries.size() > maxSize) {
            Iterator<String> eldestFirst = entries.keySet().iterator();
            boolean evicted = false;
            while (eldestFirst.hasNext()) {
                if (!isProtected(eldestFirst.next())) {
                    eldestFirst.remove();
                    evicted = true;
                    break;
                }
            }
            if (!evicted) {
                return;
            }
        }
    }
}
