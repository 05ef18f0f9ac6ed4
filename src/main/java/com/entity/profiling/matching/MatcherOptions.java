package com.entity.profiling.matching;

/**
 * Configuration for the name matcher.
 * Use {@link #builder()} to construct or {@link #defaults()} for the standard policy.
 */
public class MatcherOptions {

    public static final double DEFAULT_FUZZY_THRESHOLD = 85.0;
    public static final double DEFAULT_TIE_MARGIN = 2.0;
    public static final double DEFAULT_STATE_MISMATCH_PENALTY = 0.15;

    private final double fuzzyThreshold;
    private final double tieMargin;
    private final double stateMismatchPenalty;
    private final boolean stateValidationEnabled;
    private final boolean consortiumDetectionEnabled;

    private MatcherOptions(Builder builder) {
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.tieMargin = builder.tieMargin;
        this.stateMismatchPenalty = builder.stateMismatchPenalty;
        this.stateValidationEnabled = builder.stateValidationEnabled;
        this.consortiumDetectionEnabled = builder.consortiumDetectionEnabled;
    }

    public static MatcherOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Minimum fuzzy score (0-100) for a candidate to be accepted.
     */
    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    /**
     * Any other entity scoring within this many points of the top score makes the
     * result ambiguous.
     */
    public double getTieMargin() {
        return tieMargin;
    }

    /**
     * Confidence deducted when the recipient's state is not one of the candidate's states.
     */
    public double getStateMismatchPenalty() {
        return stateMismatchPenalty;
    }

    public boolean isStateValidationEnabled() {
        return stateValidationEnabled;
    }

    public boolean isConsortiumDetectionEnabled() {
        return consortiumDetectionEnabled;
    }

    @Override
    public String toString() {
        return "MatcherOptions{" +
                "fuzzyThreshold=" + fuzzyThreshold +
                ", tieMargin=" + tieMargin +
                ", stateMismatchPenalty=" + stateMismatchPenalty +
                ", stateValidationEnabled=" + stateValidationEnabled +
                ", consortiumDetectionEnabled=" + consortiumDetectionEnabled +
                '}';
    }

    public static class Builder {
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private double tieMargin = DEFAULT_TIE_MARGIN;
        private double stateMismatchPenalty = DEFAULT_STATE_MISMATCH_PENALTY;
        private boolean stateValidationEnabled = true;
        private boolean consortiumDetectionEnabled = true;

        public Builder fuzzyThreshold(double threshold) {
            if (threshold <= 0.0 || threshold > 100.0) {
                throw new IllegalArgumentException("Fuzzy threshold must be in (0, 100]");
            }
            this.fuzzyThreshold = threshold;
            return this;
        }

        public Builder tieMargin(double margin) {
            if (margin < 0.0 || margin >= 100.0) {
                throw new IllegalArgumentException("Tie margin must be in [0, 100)");
            }
            this.tieMargin = margin;
            return this;
        }

        public Builder stateMismatchPenalty(double penalty) {
            if (penalty < 0.0 || penalty > 1.0) {
                throw new IllegalArgumentException("State mismatch penalty must be between 0.0 and 1.0");
            }
            this.stateMismatchPenalty = penalty;
            return this;
        }

        public Builder stateValidationEnabled(boolean enabled) {
            this.stateValidationEnabled = enabled;
            return this;
        }

        public Builder consortiumDetectionEnabled(boolean enabled) {
            this.consortiumDetectionEnabled = enabled;
            return this;
        }

        public MatcherOptions build() {
            return new MatcherOptions(this);
        }
    }
}
