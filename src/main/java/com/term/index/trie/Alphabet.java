package com.term.index.trie;

import java.util.Arrays;
import java.util.Collection;

/**
 * Immutable set of code points observed across the vocabulary.
 * Characters outside the alphabet are legal in queries; they simply never
 * match a trie edge.
 */
public final class Alphabet {

    private static final Alphabet EMPTY = new Alphabet(new int[0]);

    private final int[] codePoints;

    private Alphabet(int[] sortedCodePoints) {
        this.codePoints = sortedCodePoints;
    }

    /**
     * Creates an alphabet from an arbitrary collection of code points.
     */
    public static Alphabet of(Collection<Integer> codePoints) {
        if (codePoints.isEmpty()) {
            return EMPTY;
        }
        int[] sorted = codePoints.stream().mapToInt(Integer::intValue).sorted().distinct().toArray();
        return new Alphabet(sorted);
    }

    public static Alphabet empty() {
        return EMPTY;
    }

    public boolean contains(int codePoint) {
        return Arrays.binarySearch(codePoints, codePoint) >= 0;
    }

    public int size() {
        return codePoints.length;
    }

    public boolean isEmpty() {
        return codePoints.length == 0;
    }

    /**
     * Returns the code points in ascending order.
     */
    public int[] toArray() {
        return codePoints.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alphabet other)) return false;
        return Arrays.equals(codePoints, other.codePoints);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(codePoints);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Alphabet{");
        for (int cp : codePoints) {
            sb.appendCodePoint(cp);
        }
        return sb.append('}').toString();
    }
}
