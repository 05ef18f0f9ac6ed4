package com.entity.profiling.hazard;

/**
 * Configuration for hazard aggregation.
 */
public class AggregationOptions {

    public static final int DEFAULT_TOP_N = 5;

    private final int topN;
    private final boolean expandStateFallback;

    private AggregationOptions(Builder builder) {
        this.topN = builder.topN;
        this.expandStateFallback = builder.expandStateFallback;
    }

    public static AggregationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of hazards kept in the ranked summary.
     */
    public int getTopN() {
        return topN;
    }

    /**
     * Whether a fallback entry on a state unit is spread over that state's counties with
     * equal weights when the table has no record for the state itself.
     */
    public boolean isExpandStateFallback() {
        return expandStateFallback;
    }

    public static class Builder {
        private int topN = DEFAULT_TOP_N;
        private boolean expandStateFallback = true;

        public Builder topN(int topN) {
            if (topN < 1) {
                throw new IllegalArgumentException("topN must be >= 1");
            }
            this.topN = topN;
            return this;
        }

        public Builder expandStateFallback(boolean expand) {
            this.expandStateFallback = expand;
            return this;
        }

        public AggregationOptions build() {
            return new AggregationOptions(this);
        }
    }
}
