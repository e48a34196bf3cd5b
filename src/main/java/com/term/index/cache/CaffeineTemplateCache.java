package com.term.index.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.term.index.automaton.LevenshteinTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caffeine-backed template cache. Each template is built at most once per key,
 * even when several queries ask for the same distance concurrently.
 */
public class CaffeineTemplateCache implements TemplateCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineTemplateCache.class);

    private static final CaffeineTemplateCache SHARED = new CaffeineTemplateCache(CacheConfig.defaults());

    private final LoadingCache<Integer, LevenshteinTemplate> cache;

    public CaffeineTemplateCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build(this::load);
        log.debug("CaffeineTemplateCache initialized: maxSize={}", config.maxSize());
    }

    /**
     * Process-wide cache, populated lazily and never expired.
     */
    public static CaffeineTemplateCache shared() {
        return SHARED;
    }

    @Override
    public LevenshteinTemplate get(int maxDistance) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance must be >= 0, got " + maxDistance);
        }
        return cache.get(maxDistance);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all templates");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    private LevenshteinTemplate load(Integer maxDistance) {
        LevenshteinTemplate template = new LevenshteinTemplate(maxDistance);
        log.debug("template.built k={} width={}", maxDistance, template.width());
        return template;
    }
}
