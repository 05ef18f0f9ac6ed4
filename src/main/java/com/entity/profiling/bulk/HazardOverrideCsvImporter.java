package com.entity.profiling.bulk;

import com.entity.profiling.core.model.HazardOverride;
import com.entity.profiling.hazard.MetricCatalog;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CSV importer for hazard score overrides.
 *
 * <pre>
 * entity_id,hazard_type,score,source
 * E1,WFIR,92.5,USFS Wildfire Risk to Communities
 * </pre>
 *
 * Rows naming a hazard type outside the catalog are rejected.
 */
public class HazardOverrideCsvImporter extends AbstractCsvImporter<HazardOverride> {

    private final MetricCatalog catalog;

    public HazardOverrideCsvImporter(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    protected List<String> requiredColumns() {
        return List.of("entity_id", "hazard_type", "score");
    }

    @Override
    protected HazardOverride parseRow(Map<String, String> row) {
        String entityId = required(row, "entity_id");
        String hazard = required(row, "hazard_type").toUpperCase(Locale.ROOT);
        if (!catalog.isHazard(hazard)) {
            throw new IllegalArgumentException("unknown hazard type '" + hazard + "'");
        }
        String raw = required(row, "score");
        double score;
        try {
            score = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid score '" + raw + "'");
        }
        return new HazardOverride(entityId, hazard, score, optional(row, "source"));
    }
}
