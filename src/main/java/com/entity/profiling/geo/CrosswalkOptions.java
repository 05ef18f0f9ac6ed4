package com.entity.profiling.geo;

/**
 * Configuration for crosswalk construction.
 */
public class CrosswalkOptions {

    public static final double DEFAULT_MIN_OVERLAP = 0.01;
    public static final double DEFAULT_WEIGHT_TOLERANCE = 1e-6;

    private final double minOverlap;
    private final double weightTolerance;

    private CrosswalkOptions(Builder builder) {
        this.minOverlap = builder.minOverlap;
        this.weightTolerance = builder.weightTolerance;
    }

    public static CrosswalkOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Overlap fraction under which an intersection is treated as a digitizing sliver and dropped.
     */
    public double getMinOverlap() {
        return minOverlap;
    }

    /**
     * Allowed deviation of an entity's weight sum from 1.0.
     */
    public double getWeightTolerance() {
        return weightTolerance;
    }

    public static class Builder {
        private double minOverlap = DEFAULT_MIN_OVERLAP;
        private double weightTolerance = DEFAULT_WEIGHT_TOLERANCE;

        public Builder minOverlap(double minOverlap) {
            if (minOverlap < 0.0 || minOverlap >= 1.0) {
                throw new IllegalArgumentException("minOverlap must be in [0, 1)");
            }
            this.minOverlap = minOverlap;
            return this;
        }

        public Builder weightTolerance(double tolerance) {
            if (tolerance <= 0.0 || tolerance >= 0.1) {
                throw new IllegalArgumentException("weightTolerance must be in (0, 0.1)");
            }
            this.weightTolerance = tolerance;
            return this;
        }

        public CrosswalkOptions build() {
            return new CrosswalkOptions(this);
        }
    }
}
