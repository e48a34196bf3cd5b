package com.term.index.trie;

import com.term.index.core.model.Terms;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mutable builder for {@link Trie}.
 * Inserting the same term twice leaves the tree unchanged. The frozen layout
 * depends only on the set of terms added, not on insertion order.
 *
 * <p>Not thread-safe; build once, then share the resulting {@link Trie}.</p>
 */
public class TrieBuilder {

    private final Node root = new Node();
    private final TreeSet<Integer> alphabet = new TreeSet<>();
    private int nodeCount = 1;
    private int termCount;

    /**
     * Adds a term to the tree.
     *
     * @param term the term to add
     * @return this builder
     * @throws IllegalArgumentException if the term is malformed
     */
    public TrieBuilder add(String term) {
        int[] codePoints = Terms.toCodePoints(term);
        Node node = root;
        for (int cp : codePoints) {
            Node child = node.children.get(cp);
            if (child == null) {
                child = new Node();
                node.children.put(cp, child);
                nodeCount++;
                alphabet.add(cp);
            }
            node = child;
        }
        if (!node.terminal) {
            node.terminal = true;
            termCount++;
        }
        return this;
    }

    /**
     * Adds every term of the given collection.
     */
    public TrieBuilder addAll(Iterable<String> terms) {
        for (String term : terms) {
            add(term);
        }
        return this;
    }

    public int termCount() {
        return termCount;
    }

    /**
     * Freezes the tree into its flat form.
     * Nodes are numbered breadth-first with edges visited in code point order,
     * and the edges of node {@code i} occupy the contiguous range
     * {@code [edgeOffsets[i], edgeOffsets[i + 1])}.
     */
    public Trie build() {
        int[] edgeOffsets = new int[nodeCount + 1];
        int[] edgeLabels = new int[nodeCount - 1];
        int[] edgeTargets = new int[nodeCount - 1];
        BitSet terminals = new BitSet(nodeCount);

        Deque<Node> queue = new ArrayDeque<>();
        queue.add(root);
        int nextId = 1;
        int edge = 0;
        int current = 0;
        while (!queue.isEmpty()) {
            Node node = queue.poll();
            edgeOffsets[current] = edge;
            if (node.terminal) {
                terminals.set(current);
            }
            for (Map.Entry<Integer, Node> entry : node.children.entrySet()) {
                edgeLabels[edge] = entry.getKey();
                edgeTargets[edge] = nextId++;
                edge++;
                queue.add(entry.getValue());
            }
            current++;
        }
        edgeOffsets[nodeCount] = edge;

        return new Trie(edgeOffsets, edgeLabels, edgeTargets, terminals, termCount, Alphabet.of(alphabet));
    }

    private static final class Node {
        private final TreeMap<Integer, Node> children = new TreeMap<>();
        private boolean terminal;
    }
}
