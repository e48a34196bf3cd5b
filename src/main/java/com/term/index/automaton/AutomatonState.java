package com.term.index.automaton;

import java.util.Arrays;

/**
 * Immutable state of a {@link LevenshteinAutomaton}: the band row reached after
 * consuming {@code depth} tree characters.
 */
public final class AutomatonState {

    private final int depth;
    private final int[] row;
    private final boolean dead;

    AutomatonState(int depth, int[] row, boolean dead) {
        this.depth = depth;
        this.row = row;
        this.dead = dead;
    }

    public int depth() {
        return depth;
    }

    public boolean isDead() {
        return dead;
    }

    /**
     * Smallest error over all live band slots.
     */
    public int minError() {
        int min = Integer.MAX_VALUE;
        for (int value : row) {
            min = Math.min(min, value);
        }
        return min;
    }

    int cell(int slot) {
        return row[slot];
    }

    int[] row() {
        return row;
    }

    /**
     * Returns a copy of the band row.
     */
    public int[] toArray() {
        return row.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AutomatonState other)) return false;
        return depth == other.depth && Arrays.equals(row, other.row);
    }

    @Override
    public int hashCode() {
        return 31 * depth + Arrays.hashCode(row);
    }

    @Override
    public String toString() {
        return "AutomatonState{depth=" + depth + ", row=" + Arrays.toString(row) + '}';
    }
}
