package com.term.index.search;

import com.term.index.automaton.AutomatonState;
import com.term.index.automaton.LevenshteinAutomaton;
import com.term.index.core.model.TermMatch;
import com.term.index.trie.Trie;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * Walks a {@link Trie} and a {@link LevenshteinAutomaton} in lockstep and reports
 * every vocabulary term within the automaton's distance bound, with its exact
 * edit distance.
 *
 * <p>A subtree is abandoned as soon as the automaton state for its prefix is dead,
 * so the work done is bounded by the prefixes that can still reach the bound,
 * not by the vocabulary size. The walk touches no shared mutable state; the same
 * trie and automaton can be searched concurrently.</p>
 *
 * <p>The query itself is reported with distance 0 when it is in the vocabulary.
 * Terms are emitted in depth-first order with edges in code point order.</p>
 */
public final class IntersectionSearch {

    private IntersectionSearch() {
        // utility class
    }

    /**
     * Returns all (term, distance) pairs within the automaton's bound.
     */
    public static List<TermMatch> search(Trie trie, LevenshteinAutomaton automaton) {
        List<TermMatch> matches = new ArrayList<>();
        search(trie, automaton, matches::add);
        return matches;
    }

    /**
     * Streams every (term, distance) pair within the automaton's bound to the consumer.
     *
     * @return counters describing the traversal
     * @throws SearchInterruptedException if the current thread is interrupted
     */
    public static SearchStats search(Trie trie, LevenshteinAutomaton automaton, Consumer<TermMatch> consumer) {
        Walk walk = new Walk(trie, automaton, consumer);
        AutomatonState initial = automaton.initialState();
        if (!trie.isEmpty() && !initial.isDead()) {
            walk.run(trie.root(), initial);
        }
        return new SearchStats(walk.visited, walk.pruned, walk.matches);
    }

    /**
     * Per-call traversal state. The walk keeps its own stack of frames, so the
     * depth of the trie is limited by heap rather than thread stack. The current
     * path lives in a single builder that is cut back to a frame's length before
     * each edge is followed.
     */
    private static final class Walk {
        private final Trie trie;
        private final LevenshteinAutomaton automaton;
        private final Consumer<TermMatch> consumer;
        private final StringBuilder path = new StringBuilder();
        private final Deque<Frame> stack = new ArrayDeque<>();
        private long visited;
        private long pruned;
        private long matches;

        private Walk(Trie trie, LevenshteinAutomaton automaton, Consumer<TermMatch> consumer) {
            this.trie = trie;
            this.automaton = automaton;
            this.consumer = consumer;
        }

        private void run(int root, AutomatonState initial) {
            enter(root, initial);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.nextEdge == trie.edgeCount(frame.node)) {
                    stack.pop();
                    continue;
                }
                int i = frame.nextEdge++;
                int label = trie.edgeLabel(frame.node, i);
                AutomatonState next = automaton.step(frame.state, label);
                if (next.isDead()) {
                    pruned++;
                    continue;
                }
                path.setLength(frame.pathLength);
                path.appendCodePoint(label);
                enter(trie.edgeTarget(frame.node, i), next);
            }
        }

        private void enter(int node, AutomatonState state) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SearchInterruptedException("Search interrupted at depth " + state.depth());
            }
            visited++;

            if (trie.isTerminal(node)) {
                OptionalInt distance = automaton.distanceIfTerminal(state);
                if (distance.isPresent()) {
                    matches++;
                    consumer.accept(new TermMatch(path.toString(), distance.getAsInt()));
                }
            }
            if (trie.edgeCount(node) > 0) {
                stack.push(new Frame(node, state, path.length()));
            }
        }
    }

    private static final class Frame {
        private final int node;
        private final AutomatonState state;
        private final int pathLength;
        private int nextEdge;

        private Frame(int node, AutomatonState state, int pathLength) {
            this.node = node;
            this.state = state;
            this.pathLength = pathLength;
        }
    }
}
