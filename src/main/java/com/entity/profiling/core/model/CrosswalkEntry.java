package com.entity.profiling.core.model;

import java.util.Objects;

/**
 * One (entity, county, weight) link of the geographic crosswalk.
 *
 * @param entityId        canonical entity id
 * @param countyUnitId    county code, or a state code for fallback entries
 * @param overlapWeight   fraction of the entity's area inside this unit
 * @param method          how the weight was derived
 * @param overlapAreaSqKm intersection area in square kilometres (0 for fallback entries)
 */
public record CrosswalkEntry(
        String entityId,
        String countyUnitId,
        double overlapWeight,
        CrosswalkMethod method,
        double overlapAreaSqKm
) {
    public CrosswalkEntry {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(countyUnitId, "countyUnitId is required");
        Objects.requireNonNull(method, "method is required");
        if (overlapWeight < 0.0 || overlapWeight > 1.0) {
            throw new IllegalArgumentException("overlapWeight must be between 0.0 and 1.0, got " + overlapWeight);
        }
    }

    /**
     * Creates the single fallback entry for an entity lacking boundary geometry.
     */
    public static CrosswalkEntry fallback(String entityId, String stateUnitId) {
        return new CrosswalkEntry(entityId, stateUnitId, 1.0, CrosswalkMethod.FALLBACK, 0.0);
    }

    public boolean isFallback() {
        return method == CrosswalkMethod.FALLBACK;
    }

    public Confidence confidence() {
        return method == CrosswalkMethod.FALLBACK ? Confidence.LOW : Confidence.HIGH;
    }
}
