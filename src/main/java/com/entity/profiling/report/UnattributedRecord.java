package com.entity.profiling.report;

import com.entity.profiling.core.model.AwardRecord;
import com.entity.profiling.core.model.MatchCandidate;
import com.entity.profiling.core.model.MatchMethod;
import com.entity.profiling.core.model.MatchResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * An award record excluded from every entity summary, with enough detail for an
 * operator to curate a new alias.
 */
public record UnattributedRecord(
        String recordId,
        String recipientName,
        String programId,
        String fiscalYear,
        BigDecimal amount,
        UnattributedReason reason,
        String detail,
        List<MatchCandidate> candidates
) {
    public UnattributedRecord {
        Objects.requireNonNull(recordId, "recordId is required");
        Objects.requireNonNull(reason, "reason is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public static UnattributedRecord of(AwardRecord record, MatchResult result) {
        UnattributedReason reason;
        if (result.method() == MatchMethod.AMBIGUOUS) {
            reason = UnattributedReason.AMBIGUOUS;
        } else if (result.isConsortium()) {
            reason = UnattributedReason.CONSORTIUM;
        } else {
            reason = UnattributedReason.NO_MATCH;
        }
        return new UnattributedRecord(record.recordId(), record.recipientName(), record.programId(),
                record.fiscalYear(), record.amount(), reason, result.reason(), result.ambiguousCandidates());
    }

    public static UnattributedRecord invalidName(AwardRecord record, String detail) {
        return new UnattributedRecord(record.recordId(), record.recipientName(), record.programId(),
                record.fiscalYear(), record.amount(), UnattributedReason.INVALID_NAME, detail, List.of());
    }
}
