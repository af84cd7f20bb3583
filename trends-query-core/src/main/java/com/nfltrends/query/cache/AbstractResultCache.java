package com.nfltrends.query.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes every operation of one cache instance behind a single lock and implements the
 * protected-entry handling of {@link #clear(boolean)} on top of the storage primitives.
 */
public abstract class AbstractResultCache<V> implements ResultCache<V> {

    private final Lock lock = new ReentrantLock();
    protected final Set<String> protectedKeys;

    protected AbstractResultCache(Set<String> protectedKeys) {
        this.protectedKeys = Set.copyOf(protectedKeys);
    }

    @Override
    public Optional<V> get(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(doGet(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, V value) {
        lock.lock();
        try {
            doPut(key, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean containsKey(String key) {
        lock.lock();
        try {
            return doContains(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear(boolean preserveProtected) {
        lock.lock();
        try {
            Map<String, V> saved = new LinkedHashMap<>();
            if (preserveProtected) {
                for (String key : protectedKeys) {
                    V value = doGet(key);
                    if (value != null) {
                        saved.put(key, value);
                    }
                }
            }
            doClear();
            saved.forEach(this::doPut);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return doStats();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> protectedKeys() {
        return protectedKeys;
    }

    protected boolean isProtected(String key) {
        return protectedKeys.contains(key);
    }

    protected abstract V doGet(String key);

    /**
     * Presence check that does not count as a use of the entry.
     */
    protected abstract boolean doContains(String key);

    protected abstract void doPut(String key, V value);

    protected abstract void doClear();

    protected abstract CacheStats doStats();
}
