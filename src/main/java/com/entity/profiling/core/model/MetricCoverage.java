package com.entity.profiling.core.model;

/**
 * How much of an entity's crosswalk weight had valid data for a metric.
 */
public enum MetricCoverage {
    FULL,
    PARTIAL,
    NONE
}
