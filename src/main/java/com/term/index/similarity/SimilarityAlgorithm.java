package com.term.index.similarity;

/**
 * Interface for pairwise term similarity.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two terms.
     *
     * @param t1 first term
     * @param t2 second term
     * @return similarity score, higher is more similar
     */
    double compute(String t1, String t2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
