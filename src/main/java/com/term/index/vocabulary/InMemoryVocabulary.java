package com.term.index.vocabulary;

import com.term.index.core.model.Terms;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable vocabulary held in memory. Terms are validated on construction.
 */
public final class InMemoryVocabulary implements Vocabulary {

    private static final InMemoryVocabulary EMPTY = new InMemoryVocabulary(Set.of());

    private final Set<String> terms;

    private InMemoryVocabulary(Set<String> terms) {
        this.terms = terms;
    }

    public static InMemoryVocabulary of(String... terms) {
        return of(Arrays.asList(terms));
    }

    /**
     * Creates a vocabulary from a collection; duplicates collapse.
     *
     * @throws NullPointerException     if a term is null
     * @throws IllegalArgumentException if a term is malformed
     */
    public static InMemoryVocabulary of(Collection<String> terms) {
        Set<String> copy = new LinkedHashSet<>();
        for (String term : terms) {
            Terms.validate(term);
            copy.add(term);
        }
        return new InMemoryVocabulary(Collections.unmodifiableSet(copy));
    }

    public static InMemoryVocabulary empty() {
        return EMPTY;
    }

    @Override
    public Set<String> terms() {
        return terms;
    }

    @Override
    public int size() {
        return terms.size();
    }

    @Override
    public boolean contains(String term) {
        return terms.contains(term);
    }

    @Override
    public String toString() {
        return "InMemoryVocabulary{size=" + terms.size() + '}';
    }
}
