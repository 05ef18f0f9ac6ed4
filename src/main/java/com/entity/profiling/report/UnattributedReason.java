package com.entity.profiling.report;

/**
 * Why an award record was not attributed to any entity.
 */
public enum UnattributedReason {
    /** No candidate reached the fuzzy threshold, or state validation rejected the best one. */
    NO_MATCH,
    /** Several entities scored within the tie margin. */
    AMBIGUOUS,
    /** The recipient is an inter-organization body. */
    CONSORTIUM,
    /** The recipient name was blank, oversized or contained control characters. */
    INVALID_NAME
}
