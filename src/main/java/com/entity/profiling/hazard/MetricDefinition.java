package com.entity.profiling.hazard;

import java.util.Objects;

/**
 * A supported hazard metric.
 *
 * @param name       metric column name, e.g. "WFIR_RISKS"
 * @param kind       aggregation semantics
 * @param role       role within the hazard type
 * @param hazardCode owning hazard type code, null for composites
 */
public record MetricDefinition(String name, MetricKind kind, MetricRole role, String hazardCode) {

    public MetricDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(role, "role is required");
        if (role != MetricRole.COMPOSITE && hazardCode == null) {
            throw new IllegalArgumentException("Per-hazard metric " + name + " needs a hazard code");
        }
    }

    public static MetricDefinition composite(String name, MetricKind kind) {
        return new MetricDefinition(name, kind, MetricRole.COMPOSITE, null);
    }
}
