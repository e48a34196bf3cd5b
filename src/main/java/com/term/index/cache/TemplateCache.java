package com.term.index.cache;

import com.term.index.automaton.LevenshteinTemplate;

/**
 * Source of {@link LevenshteinTemplate}s keyed by maximum edit distance.
 * Implementations must be safe for concurrent first access to the same key.
 */
public interface TemplateCache {

    /**
     * Returns the template for the given maximum distance, building it on first use.
     *
     * @param maxDistance the maximum edit distance
     * @return the template
     * @throws IllegalArgumentException if the distance is negative or unsupported
     */
    LevenshteinTemplate get(int maxDistance);

    /**
     * Invalidates all cached templates.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
