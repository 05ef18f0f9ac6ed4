package com.entity.profiling.core.model;

import java.util.Objects;

/**
 * One entry of an entity's ranked hazard list.
 *
 * @param code          hazard type code (e.g. "WFIR")
 * @param name          hazard display name
 * @param score         aggregated (or overriding) risk score
 * @param rating        quintile rating derived from the score
 * @param method        aggregation method that produced the score
 * @param expectedLoss  aggregated expected annual loss for the hazard, null if no data
 * @param originalScore general-model score replaced by an override, null otherwise
 * @param source        override source name, null when the general model was used
 */
public record RankedHazard(
        String code,
        String name,
        double score,
        String rating,
        AggregationMethod method,
        Double expectedLoss,
        Double originalScore,
        String source
) {
    public RankedHazard {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(method, "method is required");
    }
}
