package com.term.index.similarity;

import com.term.index.automaton.AutomatonFactory;
import com.term.index.automaton.LevenshteinAutomaton;
import com.term.index.automaton.LevenshteinTemplate;
import com.term.index.core.model.Terms;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Edit-distance similarity between two terms, computed with a bounded automaton.
 *
 * <p>The search radius is the threshold-derived bound, capped at
 * {@code maxDistance}. Pairs farther apart than that radius are treated as
 * having distance {@code max(len1, len2)}, which scores 0 whenever
 * {@code beta > 0}.</p>
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    private final LevenshteinScorer scorer;
    private final AutomatonFactory automatonFactory;
    private final double minSimilarity;
    private final int maxDistance;

    public LevenshteinSimilarity(LevenshteinScorer scorer, AutomatonFactory automatonFactory,
                                 double minSimilarity, int maxDistance) {
        if (maxDistance < 0 || maxDistance > LevenshteinTemplate.MAX_SUPPORTED_DISTANCE) {
            throw new IllegalArgumentException("maxDistance must be in [0, "
                    + LevenshteinTemplate.MAX_SUPPORTED_DISTANCE + "], got " + maxDistance);
        }
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.automatonFactory = Objects.requireNonNull(automatonFactory, "automatonFactory is required");
        this.minSimilarity = LevenshteinScorer.clampThreshold(minSimilarity);
        this.maxDistance = maxDistance;
    }

    @Override
    public double compute(String t1, String t2) {
        int[] first = Terms.toCodePoints(t1);
        int[] second = Terms.toCodePoints(t2);
        int maxLength = Math.max(first.length, second.length);
        if (maxLength == 0) {
            return 1.0;
        }
        return scorer.score(distance(t1, second, maxLength), first.length, second.length);
    }

    /**
     * Returns the edit distance between two terms, or {@code max(len1, len2)} when
     * it exceeds the search radius.
     */
    public int distance(String t1, String t2) {
        int[] second = Terms.toCodePoints(t2);
        int maxLength = Math.max(Terms.length(t1), second.length);
        return distance(t1, second, maxLength);
    }

    private int distance(String t1, int[] second, int maxLength) {
        int radius = Math.min(maxDistance, scorer.maxDistanceForThreshold(minSimilarity, maxLength));
        if (radius < 0) {
            return maxLength;
        }
        LevenshteinAutomaton automaton = automatonFactory.build(t1, radius);
        OptionalInt distance = automaton.distance(second);
        return distance.orElse(maxLength);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }
}
