package com.entity.profiling.profile;

import com.entity.profiling.core.model.AggregationMethod;
import com.entity.profiling.core.model.AwardSummary;
import com.entity.profiling.core.model.CoverageMetadata;
import com.entity.profiling.core.model.CrosswalkEntry;
import com.entity.profiling.core.model.DataCoverage;
import com.entity.profiling.core.model.GeographySource;
import com.entity.profiling.core.model.HazardSummary;
import com.entity.profiling.core.model.MetricAggregate;
import com.entity.profiling.core.model.MetricCoverage;
import com.entity.profiling.hazard.MetricCatalog;
import com.entity.profiling.hazard.MetricDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives a profile's coverage metadata, which tells the renderer which figures are
 * real data, which are state-level approximations and which are absent.
 */
public final class CoverageAssessor {

    private CoverageAssessor() {
        // Utility class
    }

    public static GeographySource geographyOf(List<CrosswalkEntry> entries) {
        if (entries.isEmpty()) {
            return GeographySource.NONE;
        }
        return entries.stream().anyMatch(CrosswalkEntry::isFallback)
                ? GeographySource.FALLBACK : GeographySource.AREA_WEIGHTED;
    }

    public static CoverageMetadata assess(List<CrosswalkEntry> entries, HazardSummary hazard,
                                          AwardSummary award, MetricCatalog catalog) {
        GeographySource geography = geographyOf(entries);

        int full = 0;
        List<String> partial = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (MetricDefinition definition : catalog.definitions()) {
            MetricAggregate aggregate = hazard.metrics().get(definition.name());
            if (aggregate == null) {
                missing.add(definition.name());
            } else if (aggregate.coverage() == MetricCoverage.FULL) {
                full++;
            } else {
                partial.add(definition.name());
            }
        }

        List<String> overridden = new ArrayList<>();
        for (Map.Entry<String, MetricAggregate> e : hazard.metrics().entrySet()) {
            if (e.getValue().method() == AggregationMethod.OVERRIDE) {
                catalog.get(e.getKey()).map(MetricDefinition::hazardCode).ifPresent(overridden::add);
            }
        }

        DataCoverage hazardData;
        if (hazard.metrics().isEmpty()) {
            hazardData = DataCoverage.ABSENT;
        } else if (geography == GeographySource.FALLBACK) {
            hazardData = DataCoverage.APPROXIMATE;
        } else {
            hazardData = DataCoverage.REAL;
        }

        return new CoverageMetadata(
                geography,
                hazard.confidence(),
                hazardData,
                award.hasAwards() ? DataCoverage.REAL : DataCoverage.ABSENT,
                full,
                partial,
                missing,
                overridden);
    }
}
