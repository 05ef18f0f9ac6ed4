package com.entity.profiling.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A raw funding award record keyed by free-text recipient name.
 *
 * @param recordId       source record identifier, used for provenance and deduplication
 * @param recipientName  free-text recipient name as published by the source
 * @param amount         obligated amount
 * @param programId      funding program identifier
 * @param fiscalYear     fiscal year as published (e.g. "2024" or "FY2024")
 * @param recipientState optional two-letter state code of the recipient, may be null
 */
public record AwardRecord(
        String recordId,
        String recipientName,
        BigDecimal amount,
        String programId,
        String fiscalYear,
        String recipientState
) {
    public AwardRecord {
        Objects.requireNonNull(recordId, "recordId is required");
        Objects.requireNonNull(recipientName, "recipientName is required");
        Objects.requireNonNull(amount, "amount is required");
        programId = programId != null ? programId : "";
        fiscalYear = fiscalYear != null ? fiscalYear : "";
    }

    public AwardRecord(String recordId, String recipientName, BigDecimal amount,
                       String programId, String fiscalYear) {
        this(recordId, recipientName, amount, programId, fiscalYear, null);
    }
}
