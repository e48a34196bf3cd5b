package com.term.index.trie;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Immutable prefix tree over a vocabulary, stored as a flat arena.
 * Node {@code 0} is the root and stands for the empty prefix. Each node owns a
 * contiguous, label-sorted run of outgoing edges; an edge carries one code point
 * and the index of its target node. A node is terminal when the prefix spelled
 * from the root is itself a vocabulary term.
 *
 * <p>Instances are read-only and safe to share between concurrent queries.</p>
 *
 * @see TrieBuilder
 */
public final class Trie {

    public static final int ROOT = 0;

    private final int[] edgeOffsets;
    private final int[] edgeLabels;
    private final int[] edgeTargets;
    private final BitSet terminals;
    private final int termCount;
    private final Alphabet alphabet;

    Trie(int[] edgeOffsets, int[] edgeLabels, int[] edgeTargets, BitSet terminals,
         int termCount, Alphabet alphabet) {
        this.edgeOffsets = edgeOffsets;
        this.edgeLabels = edgeLabels;
        this.edgeTargets = edgeTargets;
        this.terminals = terminals;
        this.termCount = termCount;
        this.alphabet = alphabet;
    }

    /**
     * Builds a tree over the given terms.
     */
    public static Trie build(Iterable<String> terms) {
        return new TrieBuilder().addAll(terms).build();
    }

    public int root() {
        return ROOT;
    }

    public boolean isTerminal(int node) {
        return terminals.get(node);
    }

    public int edgeCount(int node) {
        return edgeOffsets[node + 1] - edgeOffsets[node];
    }

    /**
     * Returns the code point on the {@code i}-th outgoing edge of a node.
     */
    public int edgeLabel(int node, int i) {
        return edgeLabels[edgeOffsets[node] + i];
    }

    /**
     * Returns the node reached through the {@code i}-th outgoing edge of a node.
     */
    public int edgeTarget(int node, int i) {
        return edgeTargets[edgeOffsets[node] + i];
    }

    public int nodeCount() {
        return edgeOffsets.length - 1;
    }

    public int termCount() {
        return termCount;
    }

    public boolean isEmpty() {
        return termCount == 0;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trie other)) return false;
        return termCount == other.termCount
                && Arrays.equals(edgeOffsets, other.edgeOffsets)
                && Arrays.equals(edgeLabels, other.edgeLabels)
                && Arrays.equals(edgeTargets, other.edgeTargets)
                && terminals.equals(other.terminals);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(edgeOffsets);
        result = 31 * result + Arrays.hashCode(edgeLabels);
        result = 31 * result + terminals.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Trie{terms=" + termCount + ", nodes=" + nodeCount() + ", alphabet=" + alphabet.size() + '}';
    }
}
