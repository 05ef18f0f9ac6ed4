package com.entity.profiling.core.model;

import java.util.Objects;

/**
 * A hazard score from a more specific secondary source that supersedes the general model
 * for one hazard type of one entity.
 */
public record HazardOverride(String entityId, String hazardType, double score, String source) {

    public HazardOverride {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(hazardType, "hazardType is required");
        if (Double.isNaN(score) || Double.isInfinite(score) || score < 0.0) {
            throw new IllegalArgumentException("override score must be a finite non-negative number");
        }
        source = source != null ? source : "";
    }
}
