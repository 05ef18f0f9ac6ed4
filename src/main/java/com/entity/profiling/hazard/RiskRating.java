package com.entity.profiling.hazard;

/**
 * Quintile ratings for 0-100 risk scores.
 */
public final class RiskRating {

    public static final String VERY_HIGH = "Very High";
    public static final String RELATIVELY_HIGH = "Relatively High";
    public static final String RELATIVELY_MODERATE = "Relatively Moderate";
    public static final String RELATIVELY_LOW = "Relatively Low";
    public static final String VERY_LOW = "Very Low";

    private RiskRating() {
        // Utility class
    }

    public static String forScore(double score) {
        if (score >= 80.0) {
            return VERY_HIGH;
        }
        if (score >= 60.0) {
            return RELATIVELY_HIGH;
        }
        if (score >= 40.0) {
            return RELATIVELY_MODERATE;
        }
        if (score >= 20.0) {
            return RELATIVELY_LOW;
        }
        return VERY_LOW;
    }
}
