package com.entity.profiling.report;

/**
 * Number of entities with full, partial and no data for one metric.
 */
public record MetricCoverageCounts(long full, long partial, long none) {
}
