package com.columnlineage.catalog;

import java.util.Locale;
import java.util.Objects;

/**
 * Key of a cached relation.
 *
 * <p>A cache is registered either under a name ({@code CACHE TABLE c1 AS ...})
 * or against the identity of the plan instance that was cached
 * ({@code df.cache()}). Named keys compare case-insensitively; instance keys
 * compare by identity, so two structurally identical plans cached separately
 * stay two distinct caches.
 */
public final class CacheKey {

    private final String name;
    private final Object instance;

    private CacheKey(String name, Object instance) {
        this.name = name;
        this.instance = instance;
    }

    /**
     * Creates a key for a cache registered under a name.
     *
     * @param name the registered name
     * @return the key
     */
    public static CacheKey named(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("cache name must not be empty");
        }
        return new CacheKey(name.toLowerCase(Locale.ROOT), null);
    }

    /**
     * Creates a key bound to the identity of a cached object.
     *
     * @param instance the cached plan (or any host-side handle)
     * @return the key
     */
    public static CacheKey instance(Object instance) {
        return new CacheKey(null, Objects.requireNonNull(instance, "instance must not be null"));
    }

    public boolean isNamed() {
        return name != null;
    }

    /**
     * Returns the registered name.
     *
     * @return the name, or null for an instance key
     */
    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CacheKey)) return false;
        CacheKey that = (CacheKey) obj;
        if (name != null) {
            return name.equals(that.name);
        }
        return instance == that.instance;
    }

    @Override
    public int hashCode() {
        return name != null ? name.hashCode() : System.identityHashCode(instance);
    }

    @Override
    public String toString() {
        return name != null
            ? "cache:" + name
            : "cache@" + Integer.toHexString(System.identityHashCode(instance));
    }
}
