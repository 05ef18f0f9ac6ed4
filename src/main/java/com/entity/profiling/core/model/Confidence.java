package com.entity.profiling.core.model;

/**
 * Coarse confidence tag attached to geographic data and the summaries derived from it.
 */
public enum Confidence {
    HIGH,
    LOW
}
