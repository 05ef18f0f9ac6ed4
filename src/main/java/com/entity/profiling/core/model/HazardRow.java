package com.entity.profiling.core.model;

import java.util.Objects;

/**
 * One raw county hazard value as supplied by the hazard data collaborator.
 *
 * @param countyUnitId county geographic code
 * @param metricName   metric column name
 * @param value        the metric value, or {@code null} when the source marked it "no data"
 */
public record HazardRow(String countyUnitId, String metricName, Double value) {

    public HazardRow {
        Objects.requireNonNull(countyUnitId, "countyUnitId is required");
        Objects.requireNonNull(metricName, "metricName is required");
        if (value != null && (value.isNaN() || value.isInfinite())) {
            throw new IllegalArgumentException("value must be finite");
        }
    }

    public static HazardRow of(String countyUnitId, String metricName, double value) {
        return new HazardRow(countyUnitId, metricName, value);
    }

    public static HazardRow sentinel(String countyUnitId, String metricName) {
        return new HazardRow(countyUnitId, metricName, null);
    }

    public boolean isSentinel() {
        return value == null;
    }
}
