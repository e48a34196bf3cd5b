package com.term.index.api;

import com.term.index.automaton.LevenshteinTemplate;
import com.term.index.similarity.LevenshteinScorer;
import com.term.index.similarity.ScoringParameters;

/**
 * Options for a {@link LevenshteinSimilarityIndex}.
 * Configures the scoring formula, the similarity threshold and the farthest
 * edit distance ever explored.
 */
public class IndexOptions {

    private static final double DEFAULT_THRESHOLD = 0.0;
    private static final int DEFAULT_MAX_DISTANCE = 2;

    private final ScoringParameters scoringParameters;
    private final double threshold;
    private final int maxDistance;

    private IndexOptions(Builder builder) {
        this.scoringParameters = new ScoringParameters(builder.alpha, builder.beta);
        this.threshold = builder.threshold;
        this.maxDistance = builder.maxDistance;
    }

    public ScoringParameters getScoringParameters() {
        return scoringParameters;
    }

    public double getAlpha() {
        return scoringParameters.alpha();
    }

    public double getBeta() {
        return scoringParameters.beta();
    }

    /**
     * Similarity threshold, already clamped to {@code [0, 1]}.
     */
    public double getThreshold() {
        return threshold;
    }

    public int getMaxDistance() {
        return maxDistance;
    }

    /**
     * Creates default options: alpha 1.8, beta 5.0, threshold 0, max distance 2.
     */
    public static IndexOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "IndexOptions{alpha=" + scoringParameters.alpha() +
                ", beta=" + scoringParameters.beta() +
                ", threshold=" + threshold +
                ", maxDistance=" + maxDistance + '}';
    }

    public static class Builder {
        private double alpha = ScoringParameters.DEFAULT_ALPHA;
        private double beta = ScoringParameters.DEFAULT_BETA;
        private double threshold = DEFAULT_THRESHOLD;
        private int maxDistance = DEFAULT_MAX_DISTANCE;

        public Builder alpha(double alpha) {
            if (!(alpha >= 0) || Double.isInfinite(alpha)) {
                throw new IllegalArgumentException("alpha must be a finite number >= 0, got " + alpha);
            }
            this.alpha = alpha;
            return this;
        }

        public Builder beta(double beta) {
            if (!(beta >= 0) || Double.isInfinite(beta)) {
                throw new IllegalArgumentException("beta must be a finite number >= 0, got " + beta);
            }
            this.beta = beta;
            return this;
        }

        /**
         * Sets the similarity threshold. Values outside {@code [0, 1]} are clamped.
         */
        public Builder threshold(double threshold) {
            this.threshold = LevenshteinScorer.clampThreshold(threshold);
            return this;
        }

        public Builder maxDistance(int maxDistance) {
            if (maxDistance < 0) {
                throw new IllegalArgumentException("maxDistance must be >= 0, got " + maxDistance);
            }
            if (maxDistance > LevenshteinTemplate.MAX_SUPPORTED_DISTANCE) {
                throw new IllegalArgumentException("maxDistance must be <= "
                        + LevenshteinTemplate.MAX_SUPPORTED_DISTANCE + ", got " + maxDistance);
            }
            this.maxDistance = maxDistance;
            return this;
        }

        public IndexOptions build() {
            return new IndexOptions(this);
        }
    }
}
