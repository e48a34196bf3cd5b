package com.term.index.core.model;

import java.util.Objects;

/**
 * A vocabulary term reached by the trie/automaton intersection, together with
 * its exact edit distance to the query.
 */
public record TermMatch(
        String term,
        int distance
) {
    public TermMatch {
        Objects.requireNonNull(term, "term is required");
        if (distance < 0) {
            throw new IllegalArgumentException("Distance must be >= 0, got " + distance);
        }
    }

    /**
     * Returns true if the matched term is identical to the query.
     */
    public boolean isExact() {
        return distance == 0;
    }

    /**
     * Returns the length of the matched term in code points.
     */
    public int termLength() {
        return term.codePointCount(0, term.length());
    }
}
