package com.term.index.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code term.index.build.duration}: Timer</li>
 *   <li>{@code term.index.build.terms}: DistributionSummary</li>
 *   <li>{@code term.index.build.nodes}: DistributionSummary</li>
 *   <li>{@code term.index.query.duration}: Timer (tag: maxDistance)</li>
 *   <li>{@code term.index.query.visited}: DistributionSummary</li>
 *   <li>{@code term.index.query.matches}: DistributionSummary</li>
 *   <li>{@code term.index.similarity.score}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<Integer, Timer> queryTimers = new ConcurrentHashMap<>();
    private final Timer buildTimer;
    private final DistributionSummary buildTermsSummary;
    private final DistributionSummary buildNodesSummary;
    private final DistributionSummary visitedSummary;
    private final DistributionSummary matchesSummary;
    private final DistributionSummary similarityScoreSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.buildTimer = Timer.builder("term.index.build.duration")
                .description("Duration of index construction")
                .register(registry);
        this.buildTermsSummary = DistributionSummary.builder("term.index.build.terms")
                .description("Number of distinct terms per built index")
                .register(registry);
        this.buildNodesSummary = DistributionSummary.builder("term.index.build.nodes")
                .description("Number of trie nodes per built index")
                .register(registry);
        this.visitedSummary = DistributionSummary.builder("term.index.query.visited")
                .description("Trie nodes visited per query")
                .register(registry);
        this.matchesSummary = DistributionSummary.builder("term.index.query.matches")
                .description("Terms within the distance bound per query")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("term.index.similarity.score")
                .description("Distribution of returned similarity scores")
                .register(registry);
    }

    @Override
    public void recordIndexBuild(int termCount, int nodeCount, Duration duration) {
        buildTimer.record(duration);
        buildTermsSummary.record(termCount);
        buildNodesSummary.record(nodeCount);
    }

    @Override
    public void recordQueryDuration(int maxDistance, Duration duration) {
        Timer timer = queryTimers.computeIfAbsent(maxDistance, k ->
                Timer.builder("term.index.query.duration")
                        .description("Duration of most-similar lookups")
                        .tag("maxDistance", String.valueOf(k))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordVisitedNodes(long visitedNodes) {
        visitedSummary.record(visitedNodes);
    }

    @Override
    public void recordMatchCount(long matches) {
        matchesSummary.record(matches);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }
}
