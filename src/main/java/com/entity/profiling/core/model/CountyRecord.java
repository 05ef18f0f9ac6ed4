package com.entity.profiling.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Per-county hazard metrics. Read-only, sourced externally.
 */
public record CountyRecord(String unitId, Map<String, MetricValue> metrics) {

    public CountyRecord {
        Objects.requireNonNull(unitId, "unitId is required");
        metrics = metrics != null ? Collections.unmodifiableMap(new TreeMap<>(metrics)) : Map.of();
    }

    /**
     * Returns the metric value if present and not flagged as "no data".
     */
    public OptionalDouble validValue(String metricName) {
        MetricValue mv = metrics.get(metricName);
        if (mv == null || mv.sentinel()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(mv.value());
    }
}
