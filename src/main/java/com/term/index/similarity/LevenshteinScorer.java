package com.term.index.similarity;

import java.util.Objects;

/**
 * Converts edit distances into similarities and similarity thresholds into
 * edit-distance search bounds.
 *
 * <p>Scores lie in {@code [0, alpha]}; with {@code alpha > 1} a score can exceed 1.0.
 * Two empty terms always score exactly 1.0.</p>
 */
public class LevenshteinScorer {

    private final ScoringParameters parameters;

    public LevenshteinScorer() {
        this(ScoringParameters.defaults());
    }

    public LevenshteinScorer(ScoringParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters are required");
    }

    /**
     * Computes {@code alpha * (1 - distance / max(len1, len2)) ^ beta}.
     *
     * @param distance edit distance between the two terms
     * @param len1     length of the first term in code points
     * @param len2     length of the second term in code points
     * @return the similarity, 1.0 when both terms are empty
     * @throws IllegalArgumentException if an argument is negative or the distance
     *                                  exceeds the longer length
     */
    public double score(int distance, int len1, int len2) {
        if (distance < 0 || len1 < 0 || len2 < 0) {
            throw new IllegalArgumentException("distance and lengths must be >= 0, got distance="
                    + distance + ", len1=" + len1 + ", len2=" + len2);
        }
        int maxLength = Math.max(len1, len2);
        if (maxLength == 0) {
            return 1.0;
        }
        if (distance > maxLength) {
            throw new IllegalArgumentException("distance " + distance
                    + " exceeds the longer term length " + maxLength);
        }
        return parameters.alpha() * Math.pow(1.0 - (double) distance / maxLength, parameters.beta());
    }

    /**
     * Returns the largest distance {@code d} such that
     * {@code score(d, maxLength, maxLength) >= minSimilarity}, i.e.
     * {@code floor(maxLength * (1 - (minSimilarity / alpha) ^ (1 / beta)))}.
     * The closed form is checked against {@link #score} so that the result is
     * exact at the boundary despite floating-point rounding.
     *
     * @param minSimilarity the similarity threshold, clamped to {@code [0, 1]}
     * @param maxLength     the longer of the two term lengths
     * @return the bound; {@code maxLength} when the clamped threshold is 0,
     *         {@code -1} when no distance reaches the threshold
     */
    public int maxDistanceForThreshold(double minSimilarity, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0, got " + maxLength);
        }
        double threshold = clampThreshold(minSimilarity);
        if (threshold <= 0.0 || maxLength == 0) {
            return maxLength;
        }
        double alpha = parameters.alpha();
        double beta = parameters.beta();
        if (alpha == 0.0) {
            return -1;
        }
        if (beta == 0.0) {
            return alpha >= threshold ? maxLength : -1;
        }

        double closedForm = Math.floor(maxLength * (1.0 - Math.pow(threshold / alpha, 1.0 / beta)));
        int bound = (int) Math.max(-1, Math.min(closedForm, maxLength));
        while (bound < maxLength && score(bound + 1, maxLength, maxLength) >= threshold) {
            bound++;
        }
        while (bound >= 0 && score(bound, maxLength, maxLength) < threshold) {
            bound--;
        }
        return bound;
    }

    /**
     * Clamps a similarity threshold into {@code [0, 1]}. NaN clamps to 0.
     */
    public static double clampThreshold(double threshold) {
        if (Double.isNaN(threshold)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, threshold));
    }

    public ScoringParameters getParameters() {
        return parameters;
    }
}
