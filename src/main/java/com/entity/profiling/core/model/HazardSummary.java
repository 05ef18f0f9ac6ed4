package com.entity.profiling.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Per-entity hazard summary: the ranked top-N hazards plus every metric that had data.
 * Metrics with no valid county data are absent from {@code metrics}, never reported as zero.
 */
public record HazardSummary(
        Confidence confidence,
        int countiesAnalyzed,
        List<RankedHazard> topHazards,
        Map<String, MetricAggregate> metrics
) {
    public HazardSummary {
        Objects.requireNonNull(confidence, "confidence is required");
        topHazards = topHazards != null ? List.copyOf(topHazards) : List.of();
        metrics = metrics != null ? Collections.unmodifiableMap(new TreeMap<>(metrics)) : Map.of();
    }

    /**
     * Summary for an entity with no geographic data at all.
     */
    public static HazardSummary empty() {
        return new HazardSummary(Confidence.LOW, 0, List.of(), Map.of());
    }
}
