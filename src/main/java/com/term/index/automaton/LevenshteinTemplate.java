package com.term.index.automaton;

/**
 * Query-independent part of a bounded edit-distance automaton for one maximum
 * distance {@code k}.
 *
 * <p>A row of the edit-distance matrix is kept only inside the band of
 * {@code 2k + 1} cells around the diagonal. Slot {@code s} of the row for tree
 * depth {@code i} holds the distance between the first {@code i} tree characters
 * and the first {@code j = i - k + s} query characters. Cells whose distance
 * exceeds {@code k}, and cells with {@code j} outside {@code [0, n]}, hold the
 * sentinel {@code k + 1}.</p>
 *
 * <p>The query enters a transition only through two bit masks over the band:
 * which slots hold a query character equal to the next tree character, and
 * which slots fall inside the query. The same template therefore serves every
 * query with the same {@code k}, and instances are immutable and shareable.</p>
 */
public final class LevenshteinTemplate {

    /** Masks are {@code int}s, one bit per band slot. */
    public static final int MAX_SUPPORTED_DISTANCE = 15;

    private final int maxDistance;
    private final int width;
    private final int dead;

    public LevenshteinTemplate(int maxDistance) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance must be >= 0, got " + maxDistance);
        }
        if (maxDistance > MAX_SUPPORTED_DISTANCE) {
            throw new IllegalArgumentException("maxDistance must be <= " + MAX_SUPPORTED_DISTANCE
                    + ", got " + maxDistance);
        }
        this.maxDistance = maxDistance;
        this.width = 2 * maxDistance + 1;
        this.dead = maxDistance + 1;
    }

    public int maxDistance() {
        return maxDistance;
    }

    /**
     * Number of slots in a band row.
     */
    public int width() {
        return width;
    }

    /**
     * Value stored in cells that are out of reach.
     */
    public int deadValue() {
        return dead;
    }

    /**
     * Returns the row before any tree character has been consumed:
     * slot {@code k + j} holds {@code j} for every query prefix length
     * {@code j <= min(k, n)}.
     *
     * @param queryLength the query length in code points
     */
    public int[] initialRow(int queryLength) {
        int[] row = new int[width];
        for (int s = 0; s < width; s++) {
            int j = s - maxDistance;
            row[s] = (j >= 0 && j <= queryLength) ? j : dead;
        }
        return row;
    }

    /**
     * Computes the next band row with unit costs for substitution, insertion and
     * deletion. Slot {@code s} of the new row derives from slot {@code s} of the
     * previous row (diagonal), slot {@code s + 1} of the previous row (the tree
     * character is dropped) and slot {@code s - 1} of the new row (a query
     * character is skipped).
     *
     * @param previous  the previous row
     * @param matchMask bit {@code s} set when the query character at slot {@code s}
     *                  equals the tree character being consumed
     * @param validMask bit {@code s} set when slot {@code s} lies inside the query
     * @return the new row
     */
    public int[] transition(int[] previous, int matchMask, int validMask) {
        int[] next = new int[width];
        for (int s = 0; s < width; s++) {
            if ((validMask & (1 << s)) == 0) {
                next[s] = dead;
                continue;
            }
            int best = previous[s] + ((matchMask & (1 << s)) != 0 ? 0 : 1);
            if (s + 1 < width) {
                best = Math.min(best, previous[s + 1] + 1);
            }
            if (s > 0) {
                best = Math.min(best, next[s - 1] + 1);
            }
            next[s] = Math.min(best, dead);
        }
        return next;
    }

    /**
     * Returns true when every cell of the row is out of reach.
     */
    public boolean isDead(int[] row) {
        for (int value : row) {
            if (value < dead) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "LevenshteinTemplate{k=" + maxDistance + ", width=" + width + '}';
    }
}
