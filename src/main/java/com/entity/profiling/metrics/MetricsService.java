package com.entity.profiling.metrics;

import com.entity.profiling.core.model.MatchMethod;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without a
 * meter registry.
 */
public interface MetricsService {

    void recordMatch(MatchMethod method);

    void recordSimilarityScore(double score);

    void recordCacheHit();

    void recordCacheMiss();

    void recordAggregationDuration(Duration duration);

    void incrementFallbackCrosswalk();

    void incrementHazardOverride();

    /**
     * @param source the input the record came from, e.g. "awards" or "hazards"
     */
    void incrementMalformedRecord(String source);

    void incrementProfileWritten();

    void incrementProfileFailure();
}
