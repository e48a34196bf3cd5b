package com.term.index.automaton;

import com.term.index.cache.CaffeineTemplateCache;
import com.term.index.cache.TemplateCache;
import com.term.index.core.model.Terms;

import java.util.Objects;

/**
 * Builds {@link LevenshteinAutomaton}s, reusing one {@link LevenshteinTemplate}
 * per maximum distance through a {@link TemplateCache}.
 */
public class AutomatonFactory {

    private final TemplateCache templateCache;

    public AutomatonFactory() {
        this(CaffeineTemplateCache.shared());
    }

    public AutomatonFactory(TemplateCache templateCache) {
        this.templateCache = Objects.requireNonNull(templateCache, "templateCache is required");
    }

    /**
     * Builds an automaton accepting every term within {@code maxDistance} edits of the query.
     *
     * @param query       the query term
     * @param maxDistance the maximum edit distance, {@code >= 0}
     * @throws IllegalArgumentException if {@code maxDistance} is negative or unsupported,
     *                                  or the query is malformed
     */
    public LevenshteinAutomaton build(String query, int maxDistance) {
        validateDistance(maxDistance);
        int[] codePoints = Terms.toCodePoints(query);
        return new LevenshteinAutomaton(templateCache.get(maxDistance), codePoints);
    }

    /**
     * Loads templates for every distance in {@code 0..maxDistance}.
     */
    public void warmUp(int maxDistance) {
        validateDistance(maxDistance);
        for (int k = 0; k <= maxDistance; k++) {
            templateCache.get(k);
        }
    }

    public TemplateCache getTemplateCache() {
        return templateCache;
    }

    private static void validateDistance(int maxDistance) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance must be >= 0, got " + maxDistance);
        }
        if (maxDistance > LevenshteinTemplate.MAX_SUPPORTED_DISTANCE) {
            throw new IllegalArgumentException("maxDistance must be <= "
                    + LevenshteinTemplate.MAX_SUPPORTED_DISTANCE + ", got " + maxDistance);
        }
    }
}
