package com.entity.profiling.core.model;

/**
 * A county metric value with its "no data" flag.
 * When {@code sentinel} is true the value is meaningless and must never be aggregated.
 */
public record MetricValue(double value, boolean sentinel) {

    private static final MetricValue NO_DATA = new MetricValue(Double.NaN, true);

    public MetricValue {
        if (!sentinel && (Double.isNaN(value) || Double.isInfinite(value))) {
            throw new IllegalArgumentException("Non-sentinel value must be finite");
        }
    }

    public static MetricValue of(double value) {
        return new MetricValue(value, false);
    }

    public static MetricValue noData() {
        return NO_DATA;
    }
}
