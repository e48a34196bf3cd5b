package com.term.index.cache;

import com.term.index.automaton.LevenshteinTemplate;

/**
 * Template "cache" that builds a fresh template on every request.
 * Used when caching is disabled; results are identical to a caching implementation.
 */
public class NoOpTemplateCache implements TemplateCache {

    @Override
    public LevenshteinTemplate get(int maxDistance) {
        return new LevenshteinTemplate(maxDistance);
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
