package com.term.index.metrics;

import java.time.Duration;

/**
 * Interface for recording similarity index metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordIndexBuild(int termCount, int nodeCount, Duration duration);

    void recordQueryDuration(int maxDistance, Duration duration);

    void recordVisitedNodes(long visitedNodes);

    void recordMatchCount(long matches);

    void recordSimilarityScore(double score);
}
