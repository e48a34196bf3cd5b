package com.term.index.api;

import com.term.index.core.model.SimilarTerm;

import java.util.List;

/**
 * Retrieves the terms most similar to a given term.
 */
public interface TermSimilarityIndex {

    /**
     * Returns up to {@code topN} terms most similar to {@code term}, most similar first.
     * The term itself is never part of the result.
     *
     * @param term the query term
     * @param topN maximum number of results, {@code >= 0}
     * @return the similar terms, ordered by descending similarity
     */
    List<SimilarTerm> mostSimilar(String term, int topN);

    /**
     * Returns up to ten most similar terms.
     */
    default List<SimilarTerm> mostSimilar(String term) {
        return mostSimilar(term, 10);
    }
}
