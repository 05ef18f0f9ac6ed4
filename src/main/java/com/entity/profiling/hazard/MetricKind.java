package com.entity.profiling.hazard;

/**
 * Aggregation semantics of a metric.
 */
public enum MetricKind {
    /**
     * Scores, percentiles, frequencies and ratios. Aggregated by weighted mean with weights
     * renormalized over the counties that have data; the result stays within the range
     * of the contributing values.
     */
    INTENSIVE,

    /**
     * Additive quantities such as expected loss or exposed population. Aggregated by
     * weighted sum and never renormalized: missing counties are an undercount reported
     * as partial coverage.
     */
    EXTENSIVE
}
