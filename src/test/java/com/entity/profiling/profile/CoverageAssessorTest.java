package com.entity.profiling.profile;

import com.entity.profiling.award.AwardAggregator;
import com.entity.profiling.core.model.AggregationMethod;
import com.entity.profiling.core.model.AwardRecord;
import com.entity.profiling.core.model.AwardSummary;
import com.entity.profiling.core.model.Confidence;
import com.entity.profiling.core.model.CoverageMetadata;
import com.entity.profiling.core.model.CrosswalkEntry;
import com.entity.profiling.core.model.CrosswalkMethod;
import com.entity.profiling.core.model.DataCoverage;
import com.entity.profiling.core.model.GeographySource;
import com.entity.profiling.core.model.HazardSummary;
import com.entity.profiling.core.model.MetricAggregate;
import com.entity.profiling.core.model.MetricCoverage;
import com.entity.profiling.hazard.MetricCatalog;
import com.entity.profiling.hazard.MetricKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoverageAssessorTest {

    private static final MetricCatalog CATALOG = MetricCatalog.builder()
            .hazard("HRCN", "Hurricane")
            .composite("POPULATION", MetricKind.EXTENSIVE)
            .build();

    private static final AwardSummary NO_AWARDS = new AwardAggregator().aggregate("E1", List.of());

    @Test
    void areaWeightedGeographyWithMixedCoverage() {
        HazardSummary hazard = new HazardSummary(Confidence.HIGH, 2, List.of(), Map.of(
                "HRCN_RISKS", new MetricAggregate(90, AggregationMethod.OVERRIDE, MetricCoverage.FULL, 2, 1.0),
                "HRCN_EALT", new MetricAggregate(10, AggregationMethod.WEIGHTED_SUM, MetricCoverage.PARTIAL, 1, 0.5)));
        AwardSummary awards = new AwardAggregator().aggregate("E1",
                List.of(new AwardRecord("R1", "x", BigDecimal.ONE, "P", "2024")));
        List<CrosswalkEntry> entries = List.of(
                new CrosswalkEntry("E1", "04001", 1.0, CrosswalkMethod.AREA_WEIGHTED, 5.0));

        CoverageMetadata coverage = CoverageAssessor.assess(entries, hazard, awards, CATALOG);

        assertEquals(GeographySource.AREA_WEIGHTED, coverage.geography());
        assertEquals(DataCoverage.REAL, coverage.hazardData());
        assertEquals(DataCoverage.REAL, coverage.awardData());
        assertEquals(1, coverage.fullMetrics());
        assertEquals(List.of("HRCN_EALT"), coverage.partialMetrics());
        assertEquals(List.of("HRCN_AFREQ", "POPULATION"), coverage.missingMetrics());
        assertEquals(List.of("HRCN"), coverage.overriddenHazards());
    }

    @Test
    void fallbackGeographyIsApproximate() {
        HazardSummary hazard = new HazardSummary(Confidence.LOW, 3, List.of(), Map.of(
                "HRCN_RISKS", new MetricAggregate(40, AggregationMethod.WEIGHTED_MEAN, MetricCoverage.FULL, 3, 1.0)));

        CoverageMetadata coverage = CoverageAssessor.assess(
                List.of(CrosswalkEntry.fallback("E1", "04")), hazard, NO_AWARDS, CATALOG);

        assertEquals(GeographySource.FALLBACK, coverage.geography());
        assertEquals(Confidence.LOW, coverage.hazardConfidence());
        assertEquals(DataCoverage.APPROXIMATE, coverage.hazardData());
        assertEquals(DataCoverage.ABSENT, coverage.awardData());
    }

    @Test
    void noGeographyIsAbsent() {
        CoverageMetadata coverage = CoverageAssessor.assess(List.of(), HazardSummary.empty(), NO_AWARDS, CATALOG);

        assertEquals(GeographySource.NONE, coverage.geography());
        assertEquals(DataCoverage.ABSENT, coverage.hazardData());
        assertEquals(4, coverage.missingMetrics().size());
    }
}
