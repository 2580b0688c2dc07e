package com.columnlineage.logical;

import com.columnlineage.catalog.CacheKey;
import com.columnlineage.expression.AttributeReference;
import java.util.List;
import java.util.Objects;

/**
 * Leaf node reading a cached relation.
 *
 * <p>Produced by {@code CACHE TABLE name AS SELECT ...} and by caching a
 * DataFrame. The plan the cache was built from is looked up in the
 * {@link com.columnlineage.catalog.CacheRegistry} under {@link #key()}.
 */
public final class InMemoryRelation extends LogicalPlan {

    private final CacheKey key;
    private final List<AttributeReference> output;

    public InMemoryRelation(CacheKey key, List<AttributeReference> output) {
        super(); // No children
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.output = copyOf(output, "output");
    }

    public CacheKey key() {
        return key;
    }

    @Override
    public List<AttributeReference> output() {
        return output;
    }

    @Override
    public String toString() {
        return String.format("InMemoryRelation(%s, %s)", key, output);
    }
}
