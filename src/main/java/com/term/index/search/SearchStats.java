package com.term.index.search;

/**
 * Counters collected during one trie/automaton intersection.
 *
 * @param visitedNodes   trie nodes whose automaton state was alive
 * @param prunedBranches edges not descended because the child state was dead
 * @param matches        terms emitted
 */
public record SearchStats(long visitedNodes, long prunedBranches, long matches) {

    @Override
    public String toString() {
        return "SearchStats{visited=" + visitedNodes +
                ", pruned=" + prunedBranches +
                ", matches=" + matches + '}';
    }
}
