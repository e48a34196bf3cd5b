package com.term.index.benchmark;

import com.term.index.api.LevenshteinSimilarityIndex;
import com.term.index.automaton.AutomatonFactory;
import com.term.index.automaton.LevenshteinAutomaton;
import com.term.index.core.model.TermMatch;
import com.term.index.search.IntersectionSearch;
import com.term.index.search.SearchStats;
import com.term.index.testutil.EditDistance;
import com.term.index.trie.Trie;
import com.term.index.vocabulary.InMemoryVocabulary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compares trie/automaton intersection against a full scan of the vocabulary.
 *
 * These tests validate that the intersection:
 * 1. Finds exactly the terms a full scan finds (correctness)
 * 2. Touches a small fraction of the trie (pruning)
 */
class FuzzySearchBenchmarkTest {

    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz";

    private List<String> vocabulary;
    private Trie trie;
    private AutomatonFactory factory;

    @BeforeEach
    void setUp() {
        vocabulary = generateWords(new Random(42), 20_000);
        trie = Trie.build(vocabulary);
        factory = new AutomatonFactory();
    }

    @Test
    void intersection_correctness_sameTermsAsFullScan() {
        Random random = new Random(7);
        for (int q = 0; q < 20; q++) {
            String query = mutate(vocabulary.get(random.nextInt(vocabulary.size())), random);
            for (int k = 0; k <= 2; k++) {
                Set<TermMatch> expected = new HashSet<>();
                for (String term : new HashSet<>(vocabulary)) {
                    int distance = EditDistance.levenshtein(query, term);
                    if (distance <= k) {
                        expected.add(new TermMatch(term, distance));
                    }
                }

                List<TermMatch> actual = IntersectionSearch.search(trie, factory.build(query, k));

                assertEquals(expected.size(), actual.size(), "query=" + query + " k=" + k);
                assertEquals(expected, new HashSet<>(actual), "query=" + query + " k=" + k);
            }
        }
    }

    @Test
    void intersection_performance_visitsFewNodes() {
        Random random = new Random(13);
        long totalVisited = 0;
        int queries = 50;
        for (int q = 0; q < queries; q++) {
            String query = mutate(vocabulary.get(random.nextInt(vocabulary.size())), random);
            LevenshteinAutomaton automaton = factory.build(query, 1);

            SearchStats stats = IntersectionSearch.search(trie, automaton, match -> { });
            totalVisited += stats.visitedNodes();
        }

        long averageVisited = totalVisited / queries;
        System.out.printf("Trie nodes: %d, average visited at k=1: %d%n", trie.nodeCount(), averageVisited);
        assertTrue(averageVisited < trie.nodeCount() / 10,
                "Expected pruning to skip most of the trie, visited " + averageVisited + " of " + trie.nodeCount());
    }

    @Test
    void index_lookup_findsMisspelledWord() {
        LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(InMemoryVocabulary.of(vocabulary));
        String original = vocabulary.get(123);
        String typo = original.substring(0, 2) + original.substring(3);

        assertTrue(index.mostSimilar(typo, 50).stream().anyMatch(s -> s.term().equals(original)),
                "Expected '" + original + "' among the neighbours of '" + typo + "'");
    }

    private static List<String> generateWords(Random random, int count) {
        List<String> words = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int length = 6 + random.nextInt(7);
            StringBuilder sb = new StringBuilder(length);
            for (int j = 0; j < length; j++) {
                sb.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
            }
            words.add(sb.toString());
        }
        return words;
    }

    private static String mutate(String word, Random random) {
        int position = random.nextInt(word.length());
        char replacement = LETTERS.charAt(random.nextInt(LETTERS.length()));
        return word.substring(0, position) + replacement + word.substring(position + 1);
    }
}
