package com.columnlineage.catalog;

import com.columnlineage.logical.LogicalPlan;
import java.util.Optional;

/**
 * Read-only view of the host's cached relations and temporary views.
 */
public interface CacheRegistry {

    /**
     * Returns the plan a cached relation was materialized from.
     *
     * @param key the cache key
     * @return the resolved plan, or empty if nothing is cached under the key
     */
    Optional<LogicalPlan> lookup(CacheKey key);

    /**
     * A registry with nothing cached.
     *
     * @return the empty registry
     */
    static CacheRegistry empty() {
        return key -> Optional.empty();
    }
}
