package com.entity.profiling.hazard;

import com.entity.profiling.core.model.AggregationMethod;
import com.entity.profiling.core.model.Confidence;
import com.entity.profiling.core.model.CrosswalkEntry;
import com.entity.profiling.core.model.CrosswalkMethod;
import com.entity.profiling.core.model.HazardOverride;
import com.entity.profiling.core.model.HazardRow;
import com.entity.profiling.core.model.HazardSummary;
import com.entity.profiling.core.model.MetricAggregate;
import com.entity.profiling.core.model.MetricCoverage;
import com.entity.profiling.core.model.RankedHazard;
import com.entity.profiling.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HazardAggregatorTest {

    private static final MetricCatalog CATALOG = MetricCatalog.nationalRiskIndex();

    private final HazardAggregator aggregator = new HazardAggregator(CATALOG);

    private static CrosswalkEntry link(String county, double weight) {
        return new CrosswalkEntry("E1", county, weight, CrosswalkMethod.AREA_WEIGHTED, 10.0);
    }

    private static CountyHazardTable table(HazardRow... rows) {
        return CountyHazardTable.from(List.of(rows), CATALOG);
    }

    @Nested
    @DisplayName("Intensive metrics")
    class Intensive {

        @Test
        @DisplayName("Weighted mean of two counties")
        void weightedMean() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(link("04001", 0.7), link("04003", 0.3)),
                    table(HazardRow.of("04001", "HRCN_RISKS", 50), HazardRow.of("04003", "HRCN_RISKS", 80)));

            MetricAggregate risk = summary.metrics().get("HRCN_RISKS");
            assertEquals(59.0, risk.value(), 1e-9);
            assertEquals(AggregationMethod.WEIGHTED_MEAN, risk.method());
            assertEquals(MetricCoverage.FULL, risk.coverage());
            assertEquals(2, risk.contributingCounties());
            assertEquals(Confidence.HIGH, summary.confidence());
            assertEquals(2, summary.countiesAnalyzed());
        }

        @Test
        @DisplayName("A no-data county is excluded and the remaining weights renormalized")
        void sentinelRenormalized() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(link("04001", 0.7), link("04003", 0.3)),
                    table(HazardRow.of("04001", "HRCN_RISKS", 50), HazardRow.sentinel("04003", "HRCN_RISKS")));

            MetricAggregate risk = summary.metrics().get("HRCN_RISKS");
            assertEquals(50.0, risk.value(), 1e-9);
            assertEquals(MetricCoverage.PARTIAL, risk.coverage());
            assertEquals(1, risk.contributingCounties());
            assertEquals(0.7, risk.coveredWeight(), 1e-9);
        }

        @Test
        @DisplayName("A genuine zero is data, not a missing value")
        void zeroIsValid() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(link("04001", 0.5), link("04003", 0.5)),
                    table(HazardRow.of("04001", "HRCN_RISKS", 0), HazardRow.of("04003", "HRCN_RISKS", 80)));

            assertEquals(40.0, summary.metrics().get("HRCN_RISKS").value(), 1e-9);
            assertEquals(MetricCoverage.FULL, summary.metrics().get("HRCN_RISKS").coverage());
        }
    }

    @Nested
    @DisplayName("Extensive metrics")
    class Extensive {

        @Test
        @DisplayName("Weighted sum is not renormalized when a county has no data")
        void sentinelNotRenormalized() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(link("04001", 0.5), link("04003", 0.5)),
                    table(HazardRow.of("04001", "HRCN_EALT", 100), HazardRow.sentinel("04003", "HRCN_EALT")));

            MetricAggregate loss = summary.metrics().get("HRCN_EALT");
            assertEquals(50.0, loss.value(), 1e-9);
            assertEquals(AggregationMethod.WEIGHTED_SUM, loss.method());
            assertEquals(MetricCoverage.PARTIAL, loss.coverage());
            assertEquals(0.5, loss.coveredWeight(), 1e-9);
        }

        @Test
        @DisplayName("Full coverage sums every weighted value")
        void weightedSum() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(link("04001", 0.25), link("04003", 0.75)),
                    table(HazardRow.of("04001", "POPULATION", 1000), HazardRow.of("04003", "POPULATION", 400)));

            assertEquals(550.0, summary.metrics().get("POPULATION").value(), 1e-9);
        }

        @Test
        @DisplayName("A crosswalk county absent from the hazard table makes the sum partial")
        void missingCountyIsPartial() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(link("04001", 0.5), link("04003", 0.5)),
                    table(HazardRow.of("04001", "HRCN_EALT", 100)));

            MetricAggregate loss = summary.metrics().get("HRCN_EALT");
            assertEquals(50.0, loss.value(), 1e-9);
            assertEquals(MetricCoverage.PARTIAL, loss.coverage());
            assertEquals(1, loss.contributingCounties());
            assertEquals(0.5, loss.coveredWeight(), 1e-9);
        }

        @Test
        @DisplayName("An intensive mean over a partly missing crosswalk is partial too")
        void missingCountyIntensiveIsPartial() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(link("04001", 0.7), link("04003", 0.3)),
                    table(HazardRow.of("04001", "HRCN_RISKS", 50)));

            MetricAggregate risk = summary.metrics().get("HRCN_RISKS");
            assertEquals(50.0, risk.value(), 1e-9);
            assertEquals(MetricCoverage.PARTIAL, risk.coverage());
        }
    }

    @Nested
    @DisplayName("Missing-data invariants")
    class Invariants {

        @RepeatedTest(50)
        @DisplayName("No-data values never change an aggregate and means stay within range")
        void sentinelsNeverContribute(RepetitionInfo info) {
            Random random = new Random(info.getCurrentRepetition());
            int n = 2 + random.nextInt(6);
            double[] weights = new double[n];
            double total = 0.0;
            for (int i = 0; i < n; i++) {
                weights[i] = 0.05 + random.nextDouble();
                total += weights[i];
            }

            List<CrosswalkEntry> entries = new ArrayList<>();
            List<HazardRow> withSentinels = new ArrayList<>();
            List<HazardRow> withoutSentinels = new ArrayList<>();
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            boolean anyValid = false;
            for (int i = 0; i < n; i++) {
                String county = String.format("04%03d", i + 1);
                entries.add(link(county, weights[i] / total));
                if (random.nextInt(3) == 0) {
                    withSentinels.add(HazardRow.sentinel(county, "WFIR_RISKS"));
                    withSentinels.add(HazardRow.sentinel(county, "WFIR_EALT"));
                } else {
                    double score = random.nextDouble() * 100.0;
                    double loss = random.nextDouble() * 1_000_000.0;
                    HazardRow scoreRow = HazardRow.of(county, "WFIR_RISKS", score);
                    HazardRow lossRow = HazardRow.of(county, "WFIR_EALT", loss);
                    withSentinels.add(scoreRow);
                    withSentinels.add(lossRow);
                    withoutSentinels.add(scoreRow);
                    withoutSentinels.add(lossRow);
                    min = Math.min(min, score);
                    max = Math.max(max, score);
                    anyValid = true;
                }
            }

            HazardSummary sentinel = aggregator.aggregate("E1", entries,
                    CountyHazardTable.from(withSentinels, CATALOG));
            HazardSummary absent = aggregator.aggregate("E1", entries,
                    CountyHazardTable.from(withoutSentinels, CATALOG));

            if (!anyValid) {
                assertFalse(sentinel.metrics().containsKey("WFIR_RISKS"));
                assertFalse(sentinel.metrics().containsKey("WFIR_EALT"));
                return;
            }
            double mean = sentinel.metrics().get("WFIR_RISKS").value();
            assertTrue(mean >= min && mean <= max, mean + " outside [" + min + ", " + max + "]");
            assertEquals(absent.metrics().get("WFIR_RISKS").value(), mean);
            assertEquals(absent.metrics().get("WFIR_EALT").value(), sentinel.metrics().get("WFIR_EALT").value());
        }

        @Test
        @DisplayName("A metric with no data in any county is omitted")
        void allSentinelsOmitted() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(link("04001", 1.0)),
                    table(HazardRow.sentinel("04001", "HRCN_RISKS"), HazardRow.of("04001", "TRND_RISKS", 10)));

            assertFalse(summary.metrics().containsKey("HRCN_RISKS"));
            assertTrue(summary.metrics().containsKey("TRND_RISKS"));
            assertFalse(summary.metrics().containsKey("POPULATION"));
        }

        @Test
        @DisplayName("An entity without geography gets the empty summary")
        void noGeography() {
            assertEquals(HazardSummary.empty(), aggregator.aggregate("E1", List.of(), table()));
        }
    }

    @Nested
    @DisplayName("Ranking")
    class Ranking {

        @Test
        @DisplayName("Hazards are ranked by score, ties by code, zero scores excluded")
        void ranking() {
            HazardSummary summary = aggregator.aggregate("E1", List.of(link("04001", 1.0)), table(
                    HazardRow.of("04001", "WFIR_RISKS", 40),
                    HazardRow.of("04001", "TRND_RISKS", 40),
                    HazardRow.of("04001", "HRCN_RISKS", 85),
                    HazardRow.of("04001", "HRCN_EALT", 1200),
                    HazardRow.of("04001", "AVLN_RISKS", 0)));

            List<RankedHazard> ranked = summary.topHazards();
            assertEquals(List.of("HRCN", "TRND", "WFIR"), ranked.stream().map(RankedHazard::code).toList());
            assertEquals("Hurricane", ranked.get(0).name());
            assertEquals(RiskRating.VERY_HIGH, ranked.get(0).rating());
            assertEquals(1200.0, ranked.get(0).expectedLoss());
            assertNull(ranked.get(1).expectedLoss());
            assertNull(ranked.get(0).originalScore());
        }

        @Test
        @DisplayName("Only the top N hazards are kept")
        void topN() {
            HazardAggregator topTwo = new HazardAggregator(CATALOG,
                    AggregationOptions.builder().topN(2).build(), null, null);
            HazardSummary summary = topTwo.aggregate("E1", List.of(link("04001", 1.0)), table(
                    HazardRow.of("04001", "WFIR_RISKS", 10),
                    HazardRow.of("04001", "TRND_RISKS", 20),
                    HazardRow.of("04001", "HRCN_RISKS", 30)));

            assertEquals(List.of("HRCN", "TRND"), summary.topHazards().stream().map(RankedHazard::code).toList());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("An override replaces the aggregated score and keeps the original for provenance")
        void overrideReplacesScore() {
            MetricsService metrics = mock(MetricsService.class);
            HazardAggregator withOverrides = new HazardAggregator(CATALOG, AggregationOptions.defaults(),
                    new InMemoryOverrideSource(List.of(new HazardOverride("E1", "TRND", 95.0, "tribal-hmp"))),
                    metrics);

            HazardSummary summary = withOverrides.aggregate("E1",
                    List.of(link("04001", 0.7), link("04003", 0.3)),
                    table(HazardRow.of("04001", "TRND_RISKS", 50), HazardRow.of("04003", "TRND_RISKS", 80),
                            HazardRow.of("04001", "HRCN_RISKS", 60), HazardRow.of("04003", "HRCN_RISKS", 60)));

            MetricAggregate tornado = summary.metrics().get("TRND_RISKS");
            assertEquals(95.0, tornado.value());
            assertEquals(AggregationMethod.OVERRIDE, tornado.method());

            RankedHazard top = summary.topHazards().get(0);
            assertEquals("TRND", top.code());
            assertEquals(AggregationMethod.OVERRIDE, top.method());
            assertEquals(59.0, top.originalScore(), 1e-9);
            assertEquals("tribal-hmp", top.source());
            verify(metrics).incrementHazardOverride();
        }

        @Test
        @DisplayName("An override applies even when no county has data for the hazard")
        void overrideWithoutCountyData() {
            HazardAggregator withOverrides = new HazardAggregator(CATALOG, AggregationOptions.defaults(),
                    new InMemoryOverrideSource(List.of(new HazardOverride("E1", "WFIR", 30.0, "plan"))), null);

            HazardSummary summary = withOverrides.aggregate("E1", List.of(link("04001", 1.0)),
                    table(HazardRow.of("04001", "HRCN_RISKS", 10)));

            MetricAggregate wildfire = summary.metrics().get("WFIR_RISKS");
            assertEquals(MetricCoverage.FULL, wildfire.coverage());
            assertEquals(0, wildfire.contributingCounties());
            assertNull(summary.topHazards().get(0).originalScore());
            assertEquals("WFIR", summary.topHazards().get(0).code());
        }

        @Test
        @DisplayName("An override applies to an entity with no crosswalk entries at LOW confidence")
        void overrideWithoutGeography() {
            HazardAggregator withOverrides = new HazardAggregator(CATALOG, AggregationOptions.defaults(),
                    new InMemoryOverrideSource(List.of(new HazardOverride("E9", "WFIR", 70.0, "usfs"))), null);

            HazardSummary summary = withOverrides.aggregate("E9", List.of(), table());

            assertEquals(Confidence.LOW, summary.confidence());
            assertEquals(0, summary.countiesAnalyzed());
            MetricAggregate wildfire = summary.metrics().get("WFIR_RISKS");
            assertEquals(70.0, wildfire.value());
            assertEquals(AggregationMethod.OVERRIDE, wildfire.method());
            assertEquals(1, summary.metrics().size());
            RankedHazard top = summary.topHazards().get(0);
            assertEquals("WFIR", top.code());
            assertEquals("usfs", top.source());
        }

        @Test
        @DisplayName("Overrides for other entities are ignored")
        void otherEntity() {
            HazardAggregator withOverrides = new HazardAggregator(CATALOG, AggregationOptions.defaults(),
                    new InMemoryOverrideSource(List.of(new HazardOverride("E2", "HRCN", 99.0, "plan"))), null);

            HazardSummary summary = withOverrides.aggregate("E1", List.of(link("04001", 1.0)),
                    table(HazardRow.of("04001", "HRCN_RISKS", 10)));
            assertEquals(10.0, summary.metrics().get("HRCN_RISKS").value());
        }
    }

    @Nested
    @DisplayName("Fallback geography")
    class Fallback {

        @Test
        @DisplayName("A state fallback is spread evenly over the state's counties with LOW confidence")
        void stateExpansion() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(CrosswalkEntry.fallback("E1", "04")),
                    table(HazardRow.of("04001", "HRCN_RISKS", 50),
                            HazardRow.of("04003", "HRCN_RISKS", 70),
                            HazardRow.of("35001", "HRCN_RISKS", 10)));

            assertEquals(Confidence.LOW, summary.confidence());
            assertEquals(2, summary.countiesAnalyzed());
            assertEquals(60.0, summary.metrics().get("HRCN_RISKS").value(), 1e-9);
        }

        @Test
        @DisplayName("A state-level record is used directly when present")
        void stateRecord() {
            HazardSummary summary = aggregator.aggregate("E1",
                    List.of(CrosswalkEntry.fallback("E1", "04")),
                    table(HazardRow.of("04", "HRCN_RISKS", 33), HazardRow.of("04001", "HRCN_RISKS", 90)));

            assertEquals(1, summary.countiesAnalyzed());
            assertEquals(33.0, summary.metrics().get("HRCN_RISKS").value(), 1e-9);
        }

        @Test
        @DisplayName("Expansion can be disabled")
        void expansionDisabled() {
            HazardAggregator noExpansion = new HazardAggregator(CATALOG,
                    AggregationOptions.builder().expandStateFallback(false).build(), null, null);
            HazardSummary summary = noExpansion.aggregate("E1",
                    List.of(CrosswalkEntry.fallback("E1", "04")),
                    table(HazardRow.of("04001", "HRCN_RISKS", 50)));

            assertEquals(Confidence.LOW, summary.confidence());
            assertEquals(0, summary.countiesAnalyzed());
            assertTrue(summary.metrics().isEmpty());
        }
    }
}
