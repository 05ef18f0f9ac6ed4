package com.entity.profiling.core.model;

/**
 * Direction of an entity's obligations across the fiscal-year range.
 */
public enum FundingTrend {
    /** No obligations at all. */
    NONE,
    /** Obligations only in the most recent years. */
    NEW,
    INCREASING,
    DECREASING,
    STABLE
}
