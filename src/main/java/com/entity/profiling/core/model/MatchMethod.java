package com.entity.profiling.core.model;

/**
 * How a raw recipient name was (or was not) attributed to a canonical entity.
 */
public enum MatchMethod {
    /**
     * Exact hit on the normalized alias table. Confidence is always 1.0.
     */
    ALIAS,

    /**
     * Unique top scorer of the fuzzy tier at or above the acceptance threshold.
     */
    FUZZY,

    /**
     * Nothing matched, or the best candidate fell below threshold after validation.
     */
    NONE,

    /**
     * Two or more entities scored within the tie margin of the top score.
     * Never auto-resolved.
     */
    AMBIGUOUS
}
