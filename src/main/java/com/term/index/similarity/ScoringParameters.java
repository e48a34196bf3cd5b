package com.term.index.similarity;

/**
 * Parameters of the edit-distance similarity
 * {@code alpha * (1 - distance / maxLength) ^ beta}
 * (Charlet and Damnati, SimBow at SemEval-2017 Task 3, section 2.2).
 *
 * @param alpha multiplicative factor, {@code >= 0}
 * @param beta  exponential factor, {@code >= 0}
 */
public record ScoringParameters(double alpha, double beta) {

    public static final double DEFAULT_ALPHA = 1.8;
    public static final double DEFAULT_BETA = 5.0;

    public ScoringParameters {
        if (!(alpha >= 0) || Double.isInfinite(alpha)) {
            throw new IllegalArgumentException("alpha must be a finite number >= 0, got " + alpha);
        }
        if (!(beta >= 0) || Double.isInfinite(beta)) {
            throw new IllegalArgumentException("beta must be a finite number >= 0, got " + beta);
        }
    }

    public static ScoringParameters defaults() {
        return new ScoringParameters(DEFAULT_ALPHA, DEFAULT_BETA);
    }
}
