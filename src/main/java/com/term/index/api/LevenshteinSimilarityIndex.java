package com.term.index.api;

import com.term.index.automaton.AutomatonFactory;
import com.term.index.automaton.LevenshteinAutomaton;
import com.term.index.cache.CacheConfig;
import com.term.index.cache.CaffeineTemplateCache;
import com.term.index.cache.NoOpTemplateCache;
import com.term.index.cache.TemplateCache;
import com.term.index.core.model.SimilarTerm;
import com.term.index.core.model.TermMatch;
import com.term.index.core.model.Terms;
import com.term.index.logging.LogContext;
import com.term.index.metrics.MetricsService;
import com.term.index.metrics.NoOpMetricsService;
import com.term.index.search.IntersectionSearch;
import com.term.index.search.SearchStats;
import com.term.index.similarity.LevenshteinScorer;
import com.term.index.trie.Trie;
import com.term.index.vocabulary.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Edit-distance similarity index over a fixed vocabulary.
 *
 * <h2>Lookup</h2>
 * <ol>
 *   <li>The search radius is {@code min(maxDistance, d)}, where {@code d} is the
 *       largest distance that can still reach the threshold for a candidate of
 *       length {@code |query| + maxDistance}.</li>
 *   <li>A bounded edit-distance automaton for the query is intersected with the
 *       vocabulary trie, so only terms within the radius are ever scored.</li>
 *   <li>The query itself is dropped, the rest scored with
 *       {@code alpha * (1 - distance / max(|query|, |term|)) ^ beta}; scores that
 *       are not positive or fall below the threshold are dropped.</li>
 *   <li>Results are sorted by descending score. Equal scores are ordered by term.</li>
 * </ol>
 *
 * <p>The trie is built once in the constructor and never modified, so any number
 * of threads may call {@link #mostSimilar(String, int)} concurrently.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * TermSimilarityIndex index = LevenshteinSimilarityIndex.builder()
 *     .vocabulary(InMemoryVocabulary.of("cat", "cats", "bat", "dog"))
 *     .options(IndexOptions.builder().maxDistance(1).build())
 *     .build();
 *
 * List&lt;SimilarTerm&gt; similar = index.mostSimilar("cat", 10);
 * </pre>
 */
public class LevenshteinSimilarityIndex implements TermSimilarityIndex {
    private static final Logger log = LoggerFactory.getLogger(LevenshteinSimilarityIndex.class);

    private final Trie trie;
    private final IndexOptions options;
    private final LevenshteinScorer scorer;
    private final AutomatonFactory automatonFactory;
    private final MetricsService metricsService;

    private LevenshteinSimilarityIndex(Builder builder) {
        this.options = builder.options;
        this.scorer = new LevenshteinScorer(options.getScoringParameters());
        this.automatonFactory = new AutomatonFactory(builder.templateCache);
        this.metricsService = builder.metricsService;

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forIndexBuild(LogContext.generateCorrelationId())) {
            this.trie = Trie.build(builder.vocabulary.terms());
            automatonFactory.warmUp(options.getMaxDistance());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordIndexBuild(trie.termCount(), trie.nodeCount(), elapsed);
            log.info("index.built terms={} nodes={} alphabet={} options={} durationMs={}",
                    trie.termCount(), trie.nodeCount(), trie.alphabet().size(), options, elapsed.toMillis());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an index with default options.
     */
    public static LevenshteinSimilarityIndex of(Vocabulary vocabulary) {
        return builder().vocabulary(vocabulary).build();
    }

    @Override
    public List<SimilarTerm> mostSimilar(String term, int topN) {
        int[] query = Terms.toCodePoints(term);
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0, got " + topN);
        }
        if (topN == 0) {
            return List.of();
        }

        int radius = searchRadius(query.length);
        if (radius < 0) {
            log.debug("query.skipped reason=threshold_unreachable threshold={}", options.getThreshold());
            return List.of();
        }

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), radius)) {
            LevenshteinAutomaton automaton = automatonFactory.build(term, radius);
            List<SimilarTerm> scored = new ArrayList<>();
            SearchStats stats = IntersectionSearch.search(trie, automaton, match -> {
                if (!match.term().equals(term)) {
                    double similarity = score(match, query.length);
                    if (similarity > 0 && similarity >= options.getThreshold()) {
                        scored.add(new SimilarTerm(match.term(), similarity));
                    }
                }
            });

            scored.sort(SimilarTerm.BY_SIMILARITY_DESC);
            List<SimilarTerm> result = scored.size() > topN
                    ? List.copyOf(scored.subList(0, topN))
                    : List.copyOf(scored);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordQueryDuration(radius, elapsed);
            metricsService.recordVisitedNodes(stats.visitedNodes());
            metricsService.recordMatchCount(stats.matches());
            result.forEach(r -> metricsService.recordSimilarityScore(r.similarity()));
            log.debug("query.completed stats={} returned={}", stats, result.size());
            return result;
        }
    }

    /**
     * Returns the edit-distance radius explored for a query of the given length,
     * or {@code -1} when the threshold cannot be reached at any distance.
     */
    int searchRadius(int queryLength) {
        int longestCandidate = queryLength + options.getMaxDistance();
        int thresholdBound = scorer.maxDistanceForThreshold(options.getThreshold(), longestCandidate);
        return Math.min(options.getMaxDistance(), thresholdBound);
    }

    private double score(TermMatch match, int queryLength) {
        return scorer.score(match.distance(), queryLength, match.termLength());
    }

    public IndexOptions getOptions() {
        return options;
    }

    /**
     * Number of distinct terms in the index.
     */
    public int size() {
        return trie.termCount();
    }

    Trie trie() {
        return trie;
    }

    TemplateCache templateCache() {
        return automatonFactory.getTemplateCache();
    }

    public static class Builder {
        private Vocabulary vocabulary;
        private IndexOptions options = IndexOptions.defaults();
        private TemplateCache templateCache = CaffeineTemplateCache.shared();
        private MetricsService metricsService = new NoOpMetricsService();

        public Builder vocabulary(Vocabulary vocabulary) {
            this.vocabulary = vocabulary;
            return this;
        }

        public Builder options(IndexOptions options) {
            this.options = options;
            return this;
        }

        public Builder templateCache(TemplateCache templateCache) {
            this.templateCache = templateCache;
            return this;
        }

        /**
         * Uses a private template cache built from the given configuration
         * instead of the shared one.
         */
        public Builder templateCache(CacheConfig config) {
            this.templateCache = config.enabled()
                    ? new CaffeineTemplateCache(config)
                    : new NoOpTemplateCache();
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public LevenshteinSimilarityIndex build() {
            Objects.requireNonNull(vocabulary, "vocabulary is required");
            Objects.requireNonNull(options, "options are required");
            Objects.requireNonNull(templateCache, "templateCache is required");
            Objects.requireNonNull(metricsService, "metricsService is required");
            return new LevenshteinSimilarityIndex(this);
        }
    }
}
