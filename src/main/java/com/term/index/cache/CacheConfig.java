package com.term.index.cache;

/**
 * Configuration for the automaton template cache.
 *
 * @param maxSize maximum number of templates kept (one per distinct distance)
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: one slot for every supported distance, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(64, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
