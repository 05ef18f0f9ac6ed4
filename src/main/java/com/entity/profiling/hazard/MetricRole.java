package com.entity.profiling.hazard;

/**
 * What a metric represents within its hazard type.
 */
public enum MetricRole {
    /** Per-hazard risk score used for ranking. */
    RISK_SCORE,
    /** Per-hazard expected annual loss. */
    EXPECTED_LOSS,
    /** Per-hazard annualized frequency. */
    FREQUENCY,
    /** Cross-hazard composite. */
    COMPOSITE
}
