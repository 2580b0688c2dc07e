package com.columnlineage.catalog;

import com.columnlineage.logical.LogicalPlan;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CacheRegistry} backed by a map.
 *
 * <p>Supports both ways a relation gets cached:
 * <pre>
 *   registry.cacheNamed("t0_cached", plan);     // CACHE TABLE t0_cached AS SELECT ...
 *   CacheKey key = registry.cacheInstance(plan); // df.cache()
 * </pre>
 */
public class InMemoryCacheRegistry implements CacheRegistry {

    private final Map<CacheKey, LogicalPlan> entries = new ConcurrentHashMap<>();

    /**
     * Caches a plan under a name.
     *
     * @param name the cache name
     * @param plan the cached plan
     * @return the key of the entry
     */
    public CacheKey cacheNamed(String name, LogicalPlan plan) {
        CacheKey key = CacheKey.named(name);
        entries.put(key, Objects.requireNonNull(plan, "plan must not be null"));
        return key;
    }

    /**
     * Caches a plan under its own identity.
     *
     * @param plan the cached plan
     * @return the key of the entry
     */
    public CacheKey cacheInstance(LogicalPlan plan) {
        CacheKey key = CacheKey.instance(Objects.requireNonNull(plan, "plan must not be null"));
        entries.put(key, plan);
        return key;
    }

    /**
     * Drops a cache entry.
     *
     * @param key the key
     * @return true if an entry was removed
     */
    public boolean uncache(CacheKey key) {
        return entries.remove(key) != null;
    }

    @Override
    public Optional<LogicalPlan> lookup(CacheKey key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(entries.get(key));
    }
}
