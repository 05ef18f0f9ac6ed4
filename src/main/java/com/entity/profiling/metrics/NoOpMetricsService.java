package com.entity.profiling.metrics;

import com.entity.profiling.core.model.MatchMethod;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatch(MatchMethod method) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordAggregationDuration(Duration duration) {
    }

    @Override
    public void incrementFallbackCrosswalk() {
    }

    @Override
    public void incrementHazardOverride() {
    }

    @Override
    public void incrementMalformedRecord(String source) {
    }

    @Override
    public void incrementProfileWritten() {
    }

    @Override
    public void incrementProfileFailure() {
    }
}
