package com.entity.profiling.core.model;

/**
 * Aggregation applied to produce a per-entity metric value.
 */
public enum AggregationMethod {
    /**
     * Intensive metrics: weights renormalized over counties with valid data.
     */
    WEIGHTED_MEAN,

    /**
     * Extensive metrics: each county value scaled by its overlap weight, not renormalized.
     */
    WEIGHTED_SUM,

    /**
     * Value taken from a specialized secondary source instead of the general model.
     */
    OVERRIDE
}
