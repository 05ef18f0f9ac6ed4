package com.entity.profiling.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Records which profile components hold real data versus fallback or absent data,
 * so the renderer can label approximate figures as such.
 *
 * @param geography          origin of the entity's crosswalk
 * @param hazardConfidence   confidence of the hazard summary
 * @param hazardData         hazard data quality
 * @param awardData          REAL when at least one award was attributed, otherwise ABSENT
 * @param fullMetrics        number of metrics with full county coverage
 * @param partialMetrics     metrics aggregated from only part of the crosswalk weight
 * @param missingMetrics     metrics omitted because no county had valid data
 * @param overriddenHazards  hazard codes whose score came from a secondary source
 */
public record CoverageMetadata(
        GeographySource geography,
        Confidence hazardConfidence,
        DataCoverage hazardData,
        DataCoverage awardData,
        int fullMetrics,
        List<String> partialMetrics,
        List<String> missingMetrics,
        List<String> overriddenHazards
) {
    public CoverageMetadata {
        Objects.requireNonNull(geography, "geography is required");
        Objects.requireNonNull(hazardConfidence, "hazardConfidence is required");
        Objects.requireNonNull(hazardData, "hazardData is required");
        Objects.requireNonNull(awardData, "awardData is required");
        partialMetrics = partialMetrics != null ? List.copyOf(partialMetrics) : List.of();
        missingMetrics = missingMetrics != null ? List.copyOf(missingMetrics) : List.of();
        overriddenHazards = overriddenHazards != null ? List.copyOf(overriddenHazards) : List.of();
    }
}
