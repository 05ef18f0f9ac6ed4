package com.entity.profiling.bulk;

import com.entity.profiling.core.model.HazardRow;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CSV importer for raw county hazard rows.
 *
 * <pre>
 * county_unit_id,metric_name,value
 * 04005,WFIR_RISKS,87.2
 * 04017,WFIR_RISKS,-999
 * </pre>
 *
 * An empty cell, a "no data" token or a negative placeholder marks the value as sentinel.
 */
public class HazardCsvImporter extends AbstractCsvImporter<HazardRow> {

    private static final Set<String> NO_DATA_TOKENS = Set.of("NA", "N/A", "NULL", "NAN", "NODATA", "INSUFFICIENT DATA");

    @Override
    protected List<String> requiredColumns() {
        return List.of("county_unit_id", "metric_name", "value");
    }

    @Override
    protected HazardRow parseRow(Map<String, String> row) {
        String county = required(row, "county_unit_id");
        String metric = required(row, "metric_name").toUpperCase(Locale.ROOT);
        String raw = row.getOrDefault("value", "");
        if (raw.isEmpty() || NO_DATA_TOKENS.contains(raw.toUpperCase(Locale.ROOT))) {
            return HazardRow.sentinel(county, metric);
        }
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value '" + raw + "' for " + metric);
        }
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0) {
            return HazardRow.sentinel(county, metric);
        }
        return HazardRow.of(county, metric, value);
    }
}
