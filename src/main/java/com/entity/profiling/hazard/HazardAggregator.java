package com.entity.profiling.hazard;

import com.entity.profiling.core.model.AggregationMethod;
import com.entity.profiling.core.model.Confidence;
import com.entity.profiling.core.model.CountyRecord;
import com.entity.profiling.core.model.CrosswalkEntry;
import com.entity.profiling.core.model.HazardOverride;
import com.entity.profiling.core.model.HazardSummary;
import com.entity.profiling.core.model.MetricAggregate;
import com.entity.profiling.core.model.MetricCoverage;
import com.entity.profiling.core.model.RankedHazard;
import com.entity.profiling.geo.StateCodes;
import com.entity.profiling.metrics.MetricsService;
import com.entity.profiling.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Aggregates county hazard metrics up to one entity through its crosswalk entries.
 *
 * <p>Intensive metrics use a weighted mean over the counties with valid data only, with
 * weights renormalized over those counties. Extensive metrics use {@code Σ weight × value}
 * without renormalization. A "no data" county value is always excluded; it is never
 * read as zero. Metrics with no contributing county are omitted from the summary.</p>
 *
 * <p>After aggregation, overrides replace individual hazard scores, then hazards with a
 * positive score are ranked by score descending, ties by hazard code ascending.</p>
 */
public class HazardAggregator {
    private static final Logger log = LoggerFactory.getLogger(HazardAggregator.class);

    private final MetricCatalog catalog;
    private final AggregationOptions options;
    private final OverrideSource overrides;
    private final MetricsService metrics;

    public HazardAggregator(MetricCatalog catalog) {
        this(catalog, AggregationOptions.defaults(), OverrideSource.none(), new NoOpMetricsService());
    }

    public HazardAggregator(MetricCatalog catalog, AggregationOptions options,
                            OverrideSource overrides, MetricsService metrics) {
        this.catalog = catalog;
        this.options = options != null ? options : AggregationOptions.defaults();
        this.overrides = overrides != null ? overrides : OverrideSource.none();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public MetricCatalog getCatalog() {
        return catalog;
    }

    public HazardSummary aggregate(String entityId, List<CrosswalkEntry> entries, CountyHazardTable table) {
        long start = System.nanoTime();
        try {
            return doAggregate(entityId, entries, table);
        } finally {
            metrics.recordAggregationDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private HazardSummary doAggregate(String entityId, List<CrosswalkEntry> entries, CountyHazardTable table) {
        if (entries.isEmpty()) {
            log.debug("hazard.noGeography entityId={}", entityId);
        }
        boolean fallback = entries.stream().anyMatch(CrosswalkEntry::isFallback);
        Confidence confidence = fallback || entries.isEmpty() ? Confidence.LOW : Confidence.HIGH;

        ResolvedCounties resolved = resolveCounties(entityId, entries, table);
        List<WeightedCounty> counties = resolved.counties();

        Map<String, MetricAggregate> aggregates = new TreeMap<>();
        for (MetricDefinition definition : catalog.definitions()) {
            aggregateMetric(definition, resolved).ifPresent(a -> aggregates.put(definition.name(), a));
        }

        Map<String, HazardOverride> applied = new TreeMap<>();
        Map<String, Double> originalScores = new TreeMap<>();
        for (String code : catalog.hazardCodes()) {
            Optional<HazardOverride> override = overrides.overrideFor(entityId, code);
            if (override.isEmpty()) {
                continue;
            }
            String scoreMetric = catalog.scoreMetric(code);
            MetricAggregate original = aggregates.get(scoreMetric);
            if (original != null) {
                originalScores.put(code, original.value());
            }
            aggregates.put(scoreMetric, new MetricAggregate(override.get().score(), AggregationMethod.OVERRIDE,
                    MetricCoverage.FULL, original != null ? original.contributingCounties() : 0,
                    original != null ? original.coveredWeight() : 0.0));
            applied.put(code, override.get());
            metrics.incrementHazardOverride();
            log.debug("hazard.override entityId={} hazard={} score={} original={} source={}",
                    entityId, code, override.get().score(), originalScores.get(code), override.get().source());
        }

        List<RankedHazard> ranked = rank(aggregates, applied, originalScores);
        return new HazardSummary(confidence, counties.size(), ranked, aggregates);
    }

    /**
     * Turns crosswalk entries into the county records actually aggregated.
     * A fallback state unit with no record of its own is spread over the state's counties.
     * Entries with no hazard record at all are counted as unresolved.
     */
    private ResolvedCounties resolveCounties(String entityId, List<CrosswalkEntry> entries,
                                                 CountyHazardTable table) {
        List<WeightedCounty> counties = new ArrayList<>();
        int unresolved = 0;
        for (CrosswalkEntry entry : entries) {
            Optional<CountyRecord> direct = table.get(entry.countyUnitId());
            if (direct.isPresent()) {
                counties.add(new WeightedCounty(direct.get(), entry.overlapWeight()));
                continue;
            }
            if (entry.isFallback() && options.isExpandStateFallback()
                    && StateCodes.isStateUnit(entry.countyUnitId())) {
                List<CountyRecord> inState = table.countiesInState(entry.countyUnitId());
                if (!inState.isEmpty()) {
                    double weight = entry.overlapWeight() / inState.size();
                    inState.forEach(c -> counties.add(new WeightedCounty(c, weight)));
                    log.debug("hazard.stateFallback entityId={} state={} counties={}",
                            entityId, entry.countyUnitId(), inState.size());
                    continue;
                }
            }
            unresolved++;
            log.debug("hazard.countyMissing entityId={} county={}", entityId, entry.countyUnitId());
        }
        return new ResolvedCounties(counties, unresolved);
    }

    private Optional<MetricAggregate> aggregateMetric(MetricDefinition definition, ResolvedCounties resolved) {
        List<WeightedCounty> counties = resolved.counties();
        double coveredWeight = 0.0;
        double weightedSum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int contributing = 0;
        for (WeightedCounty county : counties) {
            OptionalDouble value = county.record().validValue(definition.name());
            if (value.isEmpty()) {
                continue;
            }
            double v = value.getAsDouble();
            coveredWeight += county.weight();
            weightedSum += county.weight() * v;
            min = Math.min(min, v);
            max = Math.max(max, v);
            contributing++;
        }
        if (contributing == 0) {
            return Optional.empty();
        }

        // a crosswalk county missing from the table is weight that did not contribute
        MetricCoverage coverage = contributing == counties.size() && resolved.unresolved() == 0
                ? MetricCoverage.FULL : MetricCoverage.PARTIAL;
        if (definition.kind() == MetricKind.EXTENSIVE) {
            return Optional.of(new MetricAggregate(weightedSum, AggregationMethod.WEIGHTED_SUM,
                    coverage, contributing, coveredWeight));
        }
        if (coveredWeight <= 0.0) {
            return Optional.empty();
        }
        // clamp floating-point drift back into the contributing range
        double mean = Math.max(min, Math.min(max, weightedSum / coveredWeight));
        return Optional.of(new MetricAggregate(mean, AggregationMethod.WEIGHTED_MEAN,
                coverage, contributing, coveredWeight));
    }

    private List<RankedHazard> rank(Map<String, MetricAggregate> aggregates,
                                    Map<String, HazardOverride> applied,
                                    Map<String, Double> originalScores) {
        List<RankedHazard> ranked = new ArrayList<>();
        for (String code : catalog.hazardCodes()) {
            MetricAggregate score = aggregates.get(catalog.scoreMetric(code));
            if (score == null || score.value() <= 0.0) {
                continue;
            }
            MetricAggregate loss = aggregates.get(catalog.lossMetric(code));
            HazardOverride override = applied.get(code);
            ranked.add(new RankedHazard(
                    code,
                    catalog.hazardName(code),
                    score.value(),
                    RiskRating.forScore(score.value()),
                    score.method(),
                    loss != null ? loss.value() : null,
                    override != null ? originalScores.get(code) : null,
                    override != null ? override.source() : null));
        }
        ranked.sort(Comparator.comparingDouble(RankedHazard::score).reversed()
                .thenComparing(RankedHazard::code));
        return ranked.size() > options.getTopN() ? List.copyOf(ranked.subList(0, options.getTopN())) : ranked;
    }

    private record WeightedCounty(CountyRecord record, double weight) {}

    private record ResolvedCounties(List<WeightedCounty> counties, int unresolved) {}
}
