package com.term.index.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordIndexBuild(int termCount, int nodeCount, Duration duration) {
    }

    @Override
    public void recordQueryDuration(int maxDistance, Duration duration) {
    }

    @Override
    public void recordVisitedNodes(long visitedNodes) {
    }

    @Override
    public void recordMatchCount(long matches) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }
}
