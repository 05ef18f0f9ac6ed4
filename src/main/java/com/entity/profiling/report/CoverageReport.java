package com.entity.profiling.report;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of a run's data quality: what is real data, what is approximation, and
 * what was dropped.
 *
 * @param totalEntities            entities in the index
 * @param profilesWritten          profiles persisted
 * @param failedEntities           entities whose profile could not be produced, sorted
 * @param awardRecordsRead         award records accepted by the importer
 * @param duplicateAwards          award records dropped as duplicates
 * @param malformedAwards          award rows rejected by the importer
 * @param malformedHazardRows      hazard rows rejected (unparseable or unknown metric)
 * @param matchOutcomes            award records per match method
 * @param consortiumRecords        records recognized as inter-organization recipients
 * @param unattributedRecords      records excluded from every entity summary
 * @param unattributedAmount       total amount of the excluded records
 * @param entitiesWithAwards       entities with at least one attributed award
 * @param areaWeightedEntities     entities profiled from real boundary overlap
 * @param fallbackEntities         entities profiled through the state fallback
 * @param entitiesWithoutGeography entities with neither boundary nor state
 * @param hazardOverrides          hazard scores replaced by a secondary source
 * @param metricCoverage           per-metric entity counts by coverage
 */
public record CoverageReport(
        long totalEntities,
        long profilesWritten,
        List<String> failedEntities,
        long awardRecordsRead,
        long duplicateAwards,
        long malformedAwards,
        long malformedHazardRows,
        Map<String, Long> matchOutcomes,
        long consortiumRecords,
        long unattributedRecords,
        BigDecimal unattributedAmount,
        long entitiesWithAwards,
        long areaWeightedEntities,
        long fallbackEntities,
        long entitiesWithoutGeography,
        long hazardOverrides,
        Map<String, MetricCoverageCounts> metricCoverage
) {
    public CoverageReport {
        failedEntities = failedEntities != null ? List.copyOf(failedEntities) : List.of();
        matchOutcomes = matchOutcomes != null ? Collections.unmodifiableMap(new TreeMap<>(matchOutcomes)) : Map.of();
        metricCoverage = metricCoverage != null
                ? Collections.unmodifiableMap(new TreeMap<>(metricCoverage)) : Map.of();
        unattributedAmount = unattributedAmount != null ? unattributedAmount : BigDecimal.ZERO;
    }

    public long matchCount(String method) {
        return matchOutcomes.getOrDefault(method, 0L);
    }
}
