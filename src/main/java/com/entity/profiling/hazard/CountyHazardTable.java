package com.entity.profiling.hazard;

import com.entity.profiling.core.model.CountyRecord;
import com.entity.profiling.core.model.HazardRow;
import com.entity.profiling.core.model.MetricValue;
import com.entity.profiling.geo.StateCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only per-county hazard values assembled from raw rows.
 * Rows for metrics outside the catalog are rejected; a repeated (county, metric) pair
 * keeps its first value.
 */
public final class CountyHazardTable {
    private static final Logger log = LoggerFactory.getLogger(CountyHazardTable.class);

    private final Map<String, CountyRecord> records;
    private final int rejectedRows;
    private final int duplicateRows;

    private CountyHazardTable(Map<String, CountyRecord> records, int rejectedRows, int duplicateRows) {
        this.records = records;
        this.rejectedRows = rejectedRows;
        this.duplicateRows = duplicateRows;
    }

    public static CountyHazardTable from(Collection<HazardRow> rows, MetricCatalog catalog) {
        Map<String, Map<String, MetricValue>> values = new TreeMap<>();
        int rejected = 0;
        int duplicates = 0;
        for (HazardRow row : rows) {
            if (!catalog.contains(row.metricName())) {
                rejected++;
                log.warn("hazard.unknownMetric county={} metric={}", row.countyUnitId(), row.metricName());
                continue;
            }
            MetricValue value = row.isSentinel() ? MetricValue.noData() : MetricValue.of(row.value());
            Map<String, MetricValue> county = values.computeIfAbsent(row.countyUnitId(), k -> new TreeMap<>());
            if (county.putIfAbsent(row.metricName(), value) != null) {
                duplicates++;
                log.warn("hazard.duplicateRow county={} metric={} keeping=first", row.countyUnitId(), row.metricName());
            }
        }

        Map<String, CountyRecord> records = new TreeMap<>();
        values.forEach((unitId, metrics) -> records.put(unitId, new CountyRecord(unitId, metrics)));
        log.info("hazard.table.built counties={} rejected={} duplicates={}", records.size(), rejected, duplicates);
        return new CountyHazardTable(Collections.unmodifiableMap(records), rejected, duplicates);
    }

    public static CountyHazardTable of(Collection<CountyRecord> countyRecords) {
        Map<String, CountyRecord> records = new TreeMap<>();
        for (CountyRecord record : countyRecords) {
            records.put(record.unitId(), record);
        }
        return new CountyHazardTable(Collections.unmodifiableMap(records), 0, 0);
    }

    public Optional<CountyRecord> get(String unitId) {
        return Optional.ofNullable(records.get(unitId));
    }

    /**
     * County records whose FIPS code starts with the given state FIPS, in unit id order.
     * The state unit itself is not included.
     */
    public List<CountyRecord> countiesInState(String stateFips) {
        return records.values().stream()
                .filter(r -> !r.unitId().equals(stateFips))
                .filter(r -> StateCodes.stateFipsOf(r.unitId()).equals(stateFips))
                .toList();
    }

    public int size() {
        return records.size();
    }

    public int rejectedRows() {
        return rejectedRows;
    }

    public int duplicateRows() {
        return duplicateRows;
    }
}
