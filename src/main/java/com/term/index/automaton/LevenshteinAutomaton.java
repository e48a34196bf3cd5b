package com.term.index.automaton;

import java.util.OptionalInt;

/**
 * Bounded edit-distance acceptor for one query, driven one tree character at a
 * time. States are immutable, so one automaton can be stepped along any number
 * of branches, and by several threads at once.
 *
 * <p>Once a state is dead it stays dead: errors along a path never decrease.</p>
 */
public final class LevenshteinAutomaton {

    private final LevenshteinTemplate template;
    private final int[] query;
    private final int k;
    private final AutomatonState initial;

    LevenshteinAutomaton(LevenshteinTemplate template, int[] query) {
        this.template = template;
        this.query = query;
        this.k = template.maxDistance();
        int[] row = template.initialRow(query.length);
        this.initial = new AutomatonState(0, row, template.isDead(row));
    }

    /**
     * State after consuming no tree characters.
     */
    public AutomatonState initialState() {
        return initial;
    }

    /**
     * Consumes the next tree character.
     *
     * @param state     the current state
     * @param codePoint the next character on the tree path
     * @return the successor state
     */
    public AutomatonState step(AutomatonState state, int codePoint) {
        int depth = state.depth() + 1;
        if (state.isDead()) {
            return new AutomatonState(depth, state.row(), true);
        }
        int matchMask = 0;
        int validMask = 0;
        int firstColumn = depth - k;
        for (int s = 0; s < template.width(); s++) {
            int j = firstColumn + s;
            if (j < 0 || j > query.length) {
                continue;
            }
            validMask |= 1 << s;
            if (j >= 1 && query[j - 1] == codePoint) {
                matchMask |= 1 << s;
            }
        }
        int[] row = template.transition(state.row(), matchMask, validMask);
        return new AutomatonState(depth, row, template.isDead(row));
    }

    public boolean isDead(AutomatonState state) {
        return state.isDead();
    }

    /**
     * Returns the edit distance between the tree path that led to this state and
     * the whole query, if it is within the bound.
     */
    public OptionalInt distanceIfTerminal(AutomatonState state) {
        int slot = query.length - state.depth() + k;
        if (slot < 0 || slot >= template.width()) {
            return OptionalInt.empty();
        }
        int value = state.cell(slot);
        return value <= k ? OptionalInt.of(value) : OptionalInt.empty();
    }

    /**
     * Convenience: runs the automaton over a whole term and returns its distance
     * to the query, if within the bound.
     */
    public OptionalInt distance(int[] term) {
        AutomatonState state = initial;
        for (int cp : term) {
            state = step(state, cp);
            if (state.isDead()) {
                return OptionalInt.empty();
            }
        }
        return distanceIfTerminal(state);
    }

    public int maxDistance() {
        return k;
    }

    public int queryLength() {
        return query.length;
    }

    @Override
    public String toString() {
        return "LevenshteinAutomaton{k=" + k + ", queryLength=" + query.length + '}';
    }
}
