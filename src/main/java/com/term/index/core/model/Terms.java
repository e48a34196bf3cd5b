package com.term.index.core.model;

import java.util.Objects;

/**
 * Term validation and code point conversion.
 * Terms are compared character by character where a character is a Unicode
 * code point, so supplementary characters count once.
 */
public final class Terms {

    private static final int[] EMPTY = new int[0];

    private Terms() {
        // utility class
    }

    /**
     * Validates a term and returns its code points.
     *
     * @param term the term
     * @return the code points of the term
     * @throws NullPointerException     if the term is null
     * @throws IllegalArgumentException if the term contains an unpaired surrogate
     */
    public static int[] toCodePoints(String term) {
        validate(term);
        if (term.isEmpty()) {
            return EMPTY;
        }
        return term.codePoints().toArray();
    }

    /**
     * Validates that a term is representable as a sequence of code points.
     *
     * @param term the term to validate
     * @throws NullPointerException     if the term is null
     * @throws IllegalArgumentException if the term contains an unpaired surrogate
     */
    public static void validate(String term) {
        Objects.requireNonNull(term, "term must not be null");
        for (int i = 0; i < term.length(); i++) {
            char c = term.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < term.length() && Character.isLowSurrogate(term.charAt(i + 1))) {
                    i++;
                    continue;
                }
                throw new IllegalArgumentException(
                        "Term contains an unpaired high surrogate at index " + i);
            }
            if (Character.isLowSurrogate(c)) {
                throw new IllegalArgumentException(
                        "Term contains an unpaired low surrogate at index " + i);
            }
        }
    }

    /**
     * Returns the length of a term in code points.
     */
    public static int length(String term) {
        return term.codePointCount(0, term.length());
    }
}
