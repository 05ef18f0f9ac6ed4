package com.entity.profiling.core.model;

import java.util.Objects;

/**
 * Aggregated value of one metric for one entity.
 *
 * @param value                aggregated value
 * @param method               aggregation applied
 * @param coverage             FULL when every weighted county contributed, otherwise PARTIAL
 * @param contributingCounties number of counties with valid data
 * @param coveredWeight        sum of crosswalk weights of the contributing counties
 */
public record MetricAggregate(
        double value,
        AggregationMethod method,
        MetricCoverage coverage,
        int contributingCounties,
        double coveredWeight
) {
    public MetricAggregate {
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(coverage, "coverage is required");
        if (coverage == MetricCoverage.NONE) {
            throw new IllegalArgumentException("Metrics without data are omitted, not aggregated");
        }
    }
}
