package com.term.index.core.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * A term returned by a similarity index, with its similarity to the query.
 * Similarity lies in {@code [0, alpha]}, so it may exceed 1.0 when alpha does.
 */
public record SimilarTerm(
        String term,
        double similarity
) {
    /**
     * Descending similarity, ties broken by the natural order of the term.
     */
    public static final Comparator<SimilarTerm> BY_SIMILARITY_DESC =
            Comparator.comparingDouble(SimilarTerm::similarity).reversed()
                    .thenComparing(SimilarTerm::term);

    public SimilarTerm {
        Objects.requireNonNull(term, "term is required");
        if (Double.isNaN(similarity)) {
            throw new IllegalArgumentException("Similarity must be a number");
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "SimilarTerm{term='%s', similarity=%.4f}", term, similarity);
    }
}
