package com.term.index.cache;

/**
 * Snapshot of template cache activity.
 *
 * @param hitCount      lookups served from the cache
 * @param missCount     lookups that built a template
 * @param evictionCount templates dropped for size
 * @param size          templates currently held
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Fraction of lookups served from the cache, 0.0 before the first lookup.
     */
    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
