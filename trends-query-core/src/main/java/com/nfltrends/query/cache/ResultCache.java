package com.nfltrends.query.cache;

import java.util.Optional;
import java.util.Set;

/**
 * Bounded cache of query results keyed by fingerprint. A miss is an empty {@link Optional},
 * never an exception. Protected keys survive {@code clear(true)} and capacity eviction.
 */
public interface ResultCache<V> {

    Optional<V> get(String key);

    void put(String key, V value);

    boolean containsKey(String key);

    /**
     * Removes entries. With {@code preserveProtected} the current values of protected keys are
     * saved, the cache is emptied and those entries are restored.
     */
    void clear(boolean preserveProtected);

    CacheStats stats();

    Set<String> protectedKeys();
}
