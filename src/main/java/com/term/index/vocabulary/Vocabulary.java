package com.term.index.vocabulary;

import java.util.Set;

/**
 * The distinct terms a similarity index is built over.
 * Iteration order carries no meaning.
 */
public interface Vocabulary {

    /**
     * Returns the distinct terms. The returned set is unmodifiable.
     */
    Set<String> terms();

    default int size() {
        return terms().size();
    }

    default boolean contains(String term) {
        return terms().contains(term);
    }
}
