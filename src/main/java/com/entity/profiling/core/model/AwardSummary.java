package com.entity.profiling.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Per-entity funding summary.
 *
 * @param totalObligation   sum of all attributed record amounts
 * @param programs          per-program breakdown keyed by program id
 * @param recordCount       number of distinct attributed records
 * @param recordIds         contributing record ids, sorted, for provenance
 * @param yearlyObligations obligations per fiscal year within the configured range
 * @param trend             funding trend over the range
 */
public record AwardSummary(
        BigDecimal totalObligation,
        Map<String, ProgramTotal> programs,
        int recordCount,
        List<String> recordIds,
        Map<Integer, BigDecimal> yearlyObligations,
        FundingTrend trend
) {
    public AwardSummary {
        Objects.requireNonNull(totalObligation, "totalObligation is required");
        Objects.requireNonNull(trend, "trend is required");
        programs = programs != null ? Collections.unmodifiableMap(new TreeMap<>(programs)) : Map.of();
        recordIds = recordIds != null ? List.copyOf(recordIds) : List.of();
        yearlyObligations = yearlyObligations != null
                ? Collections.unmodifiableMap(new TreeMap<>(yearlyObligations)) : Map.of();
    }

    public boolean hasAwards() {
        return recordCount > 0;
    }
}
