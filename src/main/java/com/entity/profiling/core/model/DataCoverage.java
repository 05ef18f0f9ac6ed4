package com.entity.profiling.core.model;

/**
 * Whether a profile component is backed by real data, an approximation, or nothing.
 */
public enum DataCoverage {
    REAL,
    APPROXIMATE,
    ABSENT
}
