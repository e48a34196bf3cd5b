package com.term.index.api;

import com.term.index.cache.CacheConfig;
import com.term.index.cache.CaffeineTemplateCache;
import com.term.index.cache.NoOpTemplateCache;
import com.term.index.core.model.SimilarTerm;
import com.term.index.metrics.MicrometerMetricsService;
import com.term.index.similarity.LevenshteinScorer;
import com.term.index.testutil.EditDistance;
import com.term.index.vocabulary.InMemoryVocabulary;
import com.term.index.vocabulary.Vocabulary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinSimilarityIndexTest {

    private static final Vocabulary ANIMALS = InMemoryVocabulary.of("cat", "cats", "bat", "dog");

    private static LevenshteinSimilarityIndex index(Vocabulary vocabulary, IndexOptions options) {
        return LevenshteinSimilarityIndex.builder()
                .vocabulary(vocabulary)
                .options(options)
                .build();
    }

    private static List<String> termsOf(List<SimilarTerm> result) {
        return result.stream().map(SimilarTerm::term).toList();
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("cat with max distance 1 returns cats then bat")
        void testCatScenario() {
            LevenshteinSimilarityIndex index = index(ANIMALS, IndexOptions.builder().maxDistance(1).build());

            List<SimilarTerm> result = index.mostSimilar("cat", 10);

            assertEquals(List.of("cats", "bat"), termsOf(result));
            assertEquals(1.8 * Math.pow(0.75, 5), result.get(0).similarity(), 1e-12);
            assertEquals(1.8 * Math.pow(2.0 / 3.0, 5), result.get(1).similarity(), 1e-12);
        }

        @Test
        @DisplayName("Query itself is never returned")
        void testSelfExclusion() {
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(ANIMALS);
            for (String term : ANIMALS.terms()) {
                assertFalse(termsOf(index.mostSimilar(term, 10)).contains(term));
            }
        }

        @Test
        @DisplayName("Result length is min(topN, positive matches)")
        void testTopN() {
            Vocabulary vocabulary = InMemoryVocabulary.of("cat", "bat", "hat", "mat", "rat", "cart", "cast", "ca");
            LevenshteinSimilarityIndex index = index(vocabulary, IndexOptions.builder().maxDistance(1).build());

            assertEquals(7, index.mostSimilar("cat", 100).size());
            assertEquals(3, index.mostSimilar("cat", 3).size());
            assertEquals(1, index.mostSimilar("cat", 1).size());
            assertTrue(index.mostSimilar("cat", 0).isEmpty());
        }

        @Test
        @DisplayName("Equal scores are ordered by term")
        void testTieBreak() {
            Vocabulary vocabulary = InMemoryVocabulary.of("mat", "cat", "hat", "bat", "cats");
            LevenshteinSimilarityIndex index = index(vocabulary, IndexOptions.builder().maxDistance(1).build());

            assertEquals(List.of("cats", "bat", "hat", "mat"), termsOf(index.mostSimilar("cat", 10)));
        }

        @Test
        @DisplayName("Results are sorted by descending similarity")
        void testSorted() {
            Vocabulary vocabulary = InMemoryVocabulary.of("similar", "similarity", "simile", "smile", "dissimilar");
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(vocabulary);

            List<SimilarTerm> result = index.mostSimilar("similar", 10);
            for (int i = 1; i < result.size(); i++) {
                assertTrue(result.get(i - 1).similarity() >= result.get(i).similarity());
            }
            assertTrue(result.stream().allMatch(r -> r.similarity() > 0));
        }

        @Test
        @DisplayName("Query absent from the alphabet finds nothing nearby")
        void testUnseenCharacters() {
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(ANIMALS);
            assertTrue(index.mostSimilar("ÿÿÿÿÿ", 10).isEmpty());
        }

        @Test
        @DisplayName("Agrees with a brute-force scan")
        void testAgainstBruteForce() {
            Random random = new Random(5);
            List<String> terms = EditDistance.randomTerms(random, "abcd", 300, 7);
            Vocabulary vocabulary = InMemoryVocabulary.of(terms);
            IndexOptions options = IndexOptions.builder().maxDistance(2).build();
            LevenshteinSimilarityIndex index = index(vocabulary, options);
            LevenshteinScorer scorer = new LevenshteinScorer(options.getScoringParameters());

            for (String query : EditDistance.randomTerms(random, "abcde", 40, 7)) {
                List<SimilarTerm> expected = new ArrayList<>();
                for (String term : vocabulary.terms()) {
                    int distance = EditDistance.levenshtein(query, term);
                    if (term.equals(query) || distance > 2) {
                        continue;
                    }
                    double score = scorer.score(distance, query.length(), term.length());
                    if (score > 0) {
                        expected.add(new SimilarTerm(term, score));
                    }
                }
                expected.sort(SimilarTerm.BY_SIMILARITY_DESC);
                List<SimilarTerm> top = expected.subList(0, Math.min(5, expected.size()));

                assertEquals(top, index.mostSimilar(query, 5), "query='" + query + "'");
            }
        }
    }

    @Nested
    @DisplayName("Threshold")
    class ThresholdTests {

        @Test
        @DisplayName("Threshold narrows the radius and filters low scores")
        void testThresholdFilters() {
            IndexOptions options = IndexOptions.builder().threshold(0.3).maxDistance(2).build();
            LevenshteinSimilarityIndex index = index(ANIMALS, options);

            assertEquals(1, index.searchRadius(3));
            assertEquals(List.of("cats"), termsOf(index.mostSimilar("cat", 10)));
        }

        @Test
        @DisplayName("Zero threshold leaves the configured maximum distance")
        void testZeroThreshold() {
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(ANIMALS);
            assertEquals(2, index.searchRadius(3));
            assertEquals(2, index.searchRadius(0));
        }

        @Test
        @DisplayName("Unreachable threshold returns nothing")
        void testUnreachableThreshold() {
            IndexOptions options = IndexOptions.builder().alpha(0.2).threshold(0.5).build();
            LevenshteinSimilarityIndex index = index(ANIMALS, options);

            assertEquals(-1, index.searchRadius(3));
            assertTrue(index.mostSimilar("cat", 10).isEmpty());
        }
    }

    @Nested
    @DisplayName("Degenerate inputs")
    class DegenerateTests {

        @Test
        @DisplayName("Empty query excludes the empty term and scores others by length")
        void testEmptyQuery() {
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(InMemoryVocabulary.of("", "a"));
            assertTrue(index.mostSimilar("", 10).isEmpty());
        }

        @Test
        @DisplayName("Empty term in the vocabulary scores zero against a one-character query")
        void testEmptyVocabularyTerm() {
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(InMemoryVocabulary.of("", "a", "ab"));
            List<SimilarTerm> result = index.mostSimilar("a", 10);
            assertEquals(List.of("ab"), termsOf(result));
            assertEquals(1.8 * Math.pow(0.5, 5), result.get(0).similarity(), 1e-12);
        }

        @Test
        @DisplayName("Very long terms are found without exhausting the stack")
        void testVeryLongTerm() {
            String longTerm = "a".repeat(100_000);
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(InMemoryVocabulary.of(longTerm, "x"));

            List<SimilarTerm> result = index.mostSimilar(longTerm.substring(1) + "b", 10);

            assertEquals(List.of(longTerm), termsOf(result));
            assertEquals(1.8 * Math.pow(1.0 - 1.0 / 100_000, 5), result.get(0).similarity(), 1e-12);
        }

        @Test
        @DisplayName("Empty vocabulary returns nothing")
        void testEmptyVocabulary() {
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(InMemoryVocabulary.empty());
            assertEquals(0, index.size());
            assertTrue(index.mostSimilar("cat", 10).isEmpty());
        }

        @Test
        @DisplayName("Invalid arguments fail fast")
        void testInvalidArguments() {
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(ANIMALS);
            assertThrows(IllegalArgumentException.class, () -> index.mostSimilar("cat", -1));
            assertThrows(IllegalArgumentException.class, () -> index.mostSimilar("\uD800", 10));
            assertThrows(NullPointerException.class, () -> index.mostSimilar(null, 10));
            assertThrows(NullPointerException.class, () -> LevenshteinSimilarityIndex.builder().build());
        }
    }

    @Nested
    @DisplayName("Collaborators")
    class CollaboratorTests {

        @Test
        @DisplayName("Results do not depend on template caching")
        void testCacheIndependence() {
            Vocabulary vocabulary = InMemoryVocabulary.of(EditDistance.randomTerms(new Random(11), "abc", 200, 6));
            LevenshteinSimilarityIndex cached = LevenshteinSimilarityIndex.builder()
                    .vocabulary(vocabulary)
                    .templateCache(new CaffeineTemplateCache(CacheConfig.defaults()))
                    .build();
            LevenshteinSimilarityIndex uncached = LevenshteinSimilarityIndex.builder()
                    .vocabulary(vocabulary)
                    .templateCache(new NoOpTemplateCache())
                    .build();

            for (String query : List.of("abc", "cab", "a", "", "abcabc")) {
                assertEquals(uncached.mostSimilar(query, 20), cached.mostSimilar(query, 20));
            }
        }

        @Test
        @DisplayName("Construction warms templates for every distance")
        void testWarmUp() {
            CaffeineTemplateCache cache = new CaffeineTemplateCache(CacheConfig.defaults());
            LevenshteinSimilarityIndex.builder()
                    .vocabulary(ANIMALS)
                    .options(IndexOptions.builder().maxDistance(3).build())
                    .templateCache(cache)
                    .build();

            assertEquals(4, cache.getStats().size());
        }

        @Test
        @DisplayName("Cache configuration selects the template cache")
        void testCacheConfig() {
            LevenshteinSimilarityIndex enabled = LevenshteinSimilarityIndex.builder()
                    .vocabulary(ANIMALS)
                    .templateCache(CacheConfig.defaults())
                    .build();
            LevenshteinSimilarityIndex disabled = LevenshteinSimilarityIndex.builder()
                    .vocabulary(ANIMALS)
                    .templateCache(CacheConfig.disabled())
                    .build();

            assertInstanceOf(CaffeineTemplateCache.class, enabled.templateCache());
            assertNotSame(CaffeineTemplateCache.shared(), enabled.templateCache());
            assertInstanceOf(NoOpTemplateCache.class, disabled.templateCache());
            assertEquals(enabled.mostSimilar("cat", 10), disabled.mostSimilar("cat", 10));
        }

        @Test
        @DisplayName("Queries are recorded in metrics")
        void testMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.builder()
                    .vocabulary(ANIMALS)
                    .options(IndexOptions.builder().maxDistance(1).build())
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();

            index.mostSimilar("cat", 10);
            index.mostSimilar("dog", 10);

            Timer timer = registry.find("term.index.query.duration").tag("maxDistance", "1").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(1, registry.find("term.index.build.duration").timer().count());
            assertEquals(4.0, registry.find("term.index.build.terms").summary().totalAmount());
            assertEquals(2, registry.find("term.index.similarity.score").summary().count());
        }

        @Test
        @DisplayName("Concurrent queries see the same results as sequential ones")
        void testConcurrentQueries() throws Exception {
            Random random = new Random(99);
            Vocabulary vocabulary = InMemoryVocabulary.of(EditDistance.randomTerms(random, "abcde", 2_000, 8));
            LevenshteinSimilarityIndex index = LevenshteinSimilarityIndex.of(vocabulary);
            List<String> queries = EditDistance.randomTerms(random, "abcde", 100, 8);

            Map<String, List<SimilarTerm>> sequential = new HashMap<>();
            for (String query : queries) {
                sequential.put(query, index.mostSimilar(query, 10));
            }

            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<Boolean>> futures = new ArrayList<>();
                for (int round = 0; round < 4; round++) {
                    for (String query : queries) {
                        futures.add(executor.submit(() -> sequential.get(query).equals(index.mostSimilar(query, 10))));
                    }
                }
                for (Future<Boolean> future : futures) {
                    assertTrue(future.get(30, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
