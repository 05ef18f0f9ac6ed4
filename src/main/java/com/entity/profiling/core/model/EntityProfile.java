package com.entity.profiling.core.model;

import java.util.Objects;

/**
 * Merged hazard and award summary for one entity. The sole durable output of a run,
 * overwritten on every run and consumed by the rendering layer.
 */
public record EntityProfile(
        String entityId,
        String displayName,
        HazardSummary hazardSummary,
        AwardSummary awardSummary,
        CoverageMetadata coverageMetadata
) {
    public EntityProfile {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(displayName, "displayName is required");
        Objects.requireNonNull(hazardSummary, "hazardSummary is required");
        Objects.requireNonNull(awardSummary, "awardSummary is required");
        Objects.requireNonNull(coverageMetadata, "coverageMetadata is required");
    }
}
