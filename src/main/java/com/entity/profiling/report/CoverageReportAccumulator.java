package com.entity.profiling.report;

import com.entity.profiling.core.model.GeographySource;
import com.entity.profiling.core.model.MatchMethod;
import com.entity.profiling.core.model.MatchResult;
import com.entity.profiling.core.model.MetricCoverage;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.LongAdder;

/**
 * The only mutable state shared by entity workers. Append-only and order-independent:
 * counters are {@link LongAdder}s and collections are concurrent, so workers never lock
 * and the snapshot does not depend on completion order.
 */
public class CoverageReportAccumulator {

    private final LongAdder totalEntities = new LongAdder();
    private final LongAdder profilesWritten = new LongAdder();
    private final ConcurrentLinkedQueue<String> failedEntities = new ConcurrentLinkedQueue<>();
    private final LongAdder awardRecordsRead = new LongAdder();
    private final LongAdder duplicateAwards = new LongAdder();
    private final LongAdder malformedAwards = new LongAdder();
    private final LongAdder malformedHazardRows = new LongAdder();
    private final Map<MatchMethod, LongAdder> matchOutcomes = new ConcurrentHashMap<>();
    private final LongAdder consortiumRecords = new LongAdder();
    private final ConcurrentLinkedQueue<UnattributedRecord> unattributed = new ConcurrentLinkedQueue<>();
    private final LongAdder entitiesWithAwards = new LongAdder();
    private final Map<GeographySource, LongAdder> geography = new ConcurrentHashMap<>();
    private final LongAdder hazardOverrides = new LongAdder();
    private final Map<String, Map<MetricCoverage, LongAdder>> metricCoverage = new ConcurrentHashMap<>();

    public void addEntities(long count) {
        totalEntities.add(count);
    }

    public void recordProfileWritten() {
        profilesWritten.increment();
    }

    public void recordEntityFailure(String entityId) {
        failedEntities.add(entityId);
    }

    public void addAwardRecordsRead(long count) {
        awardRecordsRead.add(count);
    }

    public void addDuplicateAwards(long count) {
        duplicateAwards.add(count);
    }

    public void addMalformedAwards(long count) {
        malformedAwards.add(count);
    }

    public void addMalformedHazardRows(long count) {
        malformedHazardRows.add(count);
    }

    public void recordMatch(MatchResult result) {
        matchOutcomes.computeIfAbsent(result.method(), k -> new LongAdder()).increment();
        if (result.isConsortium()) {
            consortiumRecords.increment();
        }
    }

    public void recordUnattributed(UnattributedRecord record) {
        unattributed.add(record);
    }

    public void recordEntityWithAwards() {
        entitiesWithAwards.increment();
    }

    public void recordGeography(GeographySource source) {
        geography.computeIfAbsent(source, k -> new LongAdder()).increment();
    }

    public void addHazardOverrides(long count) {
        hazardOverrides.add(count);
    }

    public void recordMetricCoverage(String metricName, MetricCoverage coverage) {
        metricCoverage.computeIfAbsent(metricName, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(coverage, k -> new LongAdder())
                .increment();
    }

    /**
     * Unattributed records sorted by record id.
     */
    public List<UnattributedRecord> unattributedRecords() {
        List<UnattributedRecord> records = new ArrayList<>(unattributed);
        records.sort(Comparator.comparing(UnattributedRecord::recordId)
                .thenComparing(r -> r.recipientName() != null ? r.recipientName() : ""));
        return records;
    }

    public CoverageReport snapshot() {
        Map<String, Long> outcomes = new TreeMap<>();
        for (MatchMethod method : MatchMethod.values()) {
            LongAdder adder = matchOutcomes.get(method);
            outcomes.put(method.name(), adder != null ? adder.sum() : 0L);
        }

        Map<String, MetricCoverageCounts> coverage = new TreeMap<>();
        metricCoverage.forEach((metric, counts) -> coverage.put(metric, new MetricCoverageCounts(
                sum(counts, MetricCoverage.FULL), sum(counts, MetricCoverage.PARTIAL), sum(counts, MetricCoverage.NONE))));

        BigDecimal unattributedAmount = BigDecimal.ZERO;
        for (UnattributedRecord record : unattributed) {
            if (record.amount() != null) {
                unattributedAmount = unattributedAmount.add(record.amount());
            }
        }

        List<String> failed = new ArrayList<>(failedEntities);
        failed.sort(Comparator.naturalOrder());

        Map<GeographySource, Long> geo = new EnumMap<>(GeographySource.class);
        geography.forEach((k, v) -> geo.put(k, v.sum()));

        return new CoverageReport(
                totalEntities.sum(),
                profilesWritten.sum(),
                failed,
                awardRecordsRead.sum(),
                duplicateAwards.sum(),
                malformedAwards.sum(),
                malformedHazardRows.sum(),
                outcomes,
                consortiumRecords.sum(),
                unattributed.size(),
                unattributedAmount,
                entitiesWithAwards.sum(),
                geo.getOrDefault(GeographySource.AREA_WEIGHTED, 0L),
                geo.getOrDefault(GeographySource.FALLBACK, 0L),
                geo.getOrDefault(GeographySource.NONE, 0L),
                hazardOverrides.sum(),
                coverage);
    }

    private static long sum(Map<MetricCoverage, LongAdder> counts, MetricCoverage coverage) {
        LongAdder adder = counts.get(coverage);
        return adder != null ? adder.sum() : 0L;
    }
}
