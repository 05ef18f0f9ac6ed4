package com.entity.profiling.pipeline;

import com.entity.profiling.award.AwardAggregator;
import com.entity.profiling.award.AwardDeduplicator;
import com.entity.profiling.award.FiscalYearRange;
import com.entity.profiling.cache.CaffeineMatchCache;
import com.entity.profiling.core.JsonSupport;
import com.entity.profiling.core.ReferenceDataException;
import com.entity.profiling.core.model.AwardRecord;
import com.entity.profiling.core.model.AwardSummary;
import com.entity.profiling.core.model.CanonicalEntity;
import com.entity.profiling.core.model.CoverageMetadata;
import com.entity.profiling.core.model.CrosswalkEntry;
import com.entity.profiling.core.model.EntityProfile;
import com.entity.profiling.core.model.GeographySource;
import com.entity.profiling.core.model.HazardSummary;
import com.entity.profiling.core.model.MatchResult;
import com.entity.profiling.core.model.MetricAggregate;
import com.entity.profiling.core.model.MetricCoverage;
import com.entity.profiling.geo.GeographicCrosswalk;
import com.entity.profiling.hazard.CountyHazardTable;
import com.entity.profiling.hazard.HazardAggregator;
import com.entity.profiling.hazard.MetricCatalog;
import com.entity.profiling.hazard.MetricDefinition;
import com.entity.profiling.hazard.OverrideSource;
import com.entity.profiling.index.CanonicalEntityIndex;
import com.entity.profiling.logging.LogContext;
import com.entity.profiling.matching.NameMatcher;
import com.entity.profiling.metrics.MetricsService;
import com.entity.profiling.metrics.NoOpMetricsService;
import com.entity.profiling.profile.CoverageAssessor;
import com.entity.profiling.profile.ProfileWriteException;
import com.entity.profiling.profile.ProfileWriter;
import com.entity.profiling.report.CoverageReport;
import com.entity.profiling.report.CoverageReportAccumulator;
import com.entity.profiling.report.ReportWriter;
import com.entity.profiling.report.UnattributedRecord;
import com.entity.profiling.similarity.SimilarityAlgorithm;
import com.entity.profiling.similarity.TokenSortSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Batch entry point: attributes raw award records and county hazard data to canonical
 * entities and writes one profile per entity plus the run reports.
 *
 * <pre>
 * ProfilePipeline pipeline = ProfilePipeline.builder()
 *     .entityIndex(index)
 *     .crosswalk(crosswalk)
 *     .options(PipelineOptions.defaults(Path.of("out")))
 *     .build();
 * PipelineResult result = pipeline.run(PipelineInputs.of(awards, hazardRows));
 * </pre>
 *
 * <p>The index and crosswalk are read-only for the whole run. Per-record and per-entity
 * problems are counted in the coverage report and never abort the batch; the reports are
 * written on every run.</p>
 */
public class ProfilePipeline {
    private static final Logger log = LoggerFactory.getLogger(ProfilePipeline.class);

    private final CanonicalEntityIndex index;
    private final GeographicCrosswalk crosswalk;
    private final MetricCatalog catalog;
    private final PipelineOptions options;
    private final NameMatcher matcher;
    private final HazardAggregator hazardAggregator;
    private final ProfileWriter profileWriter;
    private final ReportWriter reportWriter;
    private final MetricsService metrics;

    private ProfilePipeline(Builder builder) {
        this.index = builder.entityIndex;
        this.crosswalk = builder.crosswalk;
        this.catalog = builder.catalog;
        this.options = builder.options;
        this.metrics = builder.metricsService;
        this.matcher = new NameMatcher(index, builder.similarity, options.getMatcherOptions(), null,
                CaffeineMatchCache.create(options.getCacheConfig()), metrics);
        this.hazardAggregator = new HazardAggregator(catalog, options.getAggregationOptions(),
                builder.overrideSource, metrics);
        this.profileWriter = new ProfileWriter(options.getProfilesDir(), JsonSupport.mapper(), metrics);
        this.reportWriter = new ReportWriter(options.getOutputDir(), JsonSupport.mapper(), builder.clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    public NameMatcher getMatcher() {
        return matcher;
    }

    /**
     * Runs the whole batch.
     */
    public PipelineResult run(PipelineInputs inputs) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("run.started entities={} awards={} hazardRows={} parallelism={}",
                    index.size(), inputs.awards().size(), inputs.hazardRows().size(), options.getParallelism());
            CoverageReportAccumulator report = new CoverageReportAccumulator();
            report.addEntities(index.size());
            report.addAwardRecordsRead(inputs.awards().size());
            report.addMalformedAwards(inputs.malformedAwards());

            CoverageReport snapshot;
            try {
                AwardDeduplicator.Result deduped = new AwardDeduplicator().deduplicate(inputs.awards());
                report.addDuplicateAwards(deduped.duplicates());

                Map<String, List<AwardRecord>> attributed = matchAwards(deduped.records(), report);

                CountyHazardTable table = CountyHazardTable.from(inputs.hazardRows(), catalog);
                long malformedHazards = inputs.malformedHazardRows() + table.rejectedRows();
                report.addMalformedHazardRows(malformedHazards);
                for (long i = 0; i < malformedHazards; i++) {
                    metrics.incrementMalformedRecord("hazards");
                }

                FiscalYearRange range = options.getFiscalYearRange() != null
                        ? options.getFiscalYearRange()
                        : FiscalYearRange.spanning(deduped.records()).orElse(null);
                AwardAggregator awardAggregator = new AwardAggregator(range);

                profileEntities(runId, attributed, table, awardAggregator, report);
            } finally {
                snapshot = report.snapshot();
                reportWriter.write(snapshot, report.unattributedRecords());
            }

            log.info("run.completed profiles={} failed={} unattributed={}",
                    snapshot.profilesWritten(), snapshot.failedEntities().size(), snapshot.unattributedRecords());
            return new PipelineResult(runId, snapshot, options.getOutputDir());
        }
    }

    private Map<String, List<AwardRecord>> matchAwards(List<AwardRecord> records, CoverageReportAccumulator report) {
        Map<String, List<AwardRecord>> attributed = new TreeMap<>();
        for (AwardRecord record : records) {
            MatchResult result;
            try {
                result = matcher.match(record);
            } catch (IllegalArgumentException e) {
                log.warn("match.invalidName recordId={} error={}", record.recordId(), e.getMessage());
                metrics.incrementMalformedRecord("awards");
                report.recordUnattributed(UnattributedRecord.invalidName(record, e.getMessage()));
                continue;
            }
            report.recordMatch(result);
            if (result.isAttributed()) {
                attributed.computeIfAbsent(result.entityId(), k -> new ArrayList<>()).add(record);
            } else {
                report.recordUnattributed(UnattributedRecord.of(record, result));
            }
        }
        log.info("match.completed records={} attributedEntities={}", records.size(), attributed.size());
        return attributed;
    }

    private void profileEntities(String runId, Map<String, List<AwardRecord>> attributed, CountyHazardTable table,
                                 AwardAggregator awardAggregator, CoverageReportAccumulator report) {
        List<CanonicalEntity> entities = index.entities();
        if (options.getParallelism() == 1) {
            for (CanonicalEntity entity : entities) {
                profileEntity(runId, entity, attributed, table, awardAggregator, report);
            }
            return;
        }

        ExecutorService executor = Executors.newFixedThreadPool(options.getParallelism());
        try {
            List<Future<?>> futures = new ArrayList<>(entities.size());
            for (CanonicalEntity entity : entities) {
                futures.add(executor.submit(() ->
                        profileEntity(runId, entity, attributed, table, awardAggregator, report)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Profile run interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Profile worker failed", e.getCause());
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Computes and writes one entity's profile. Any failure is confined to this entity.
     */
    private void profileEntity(String runId, CanonicalEntity entity, Map<String, List<AwardRecord>> attributed,
                               CountyHazardTable table, AwardAggregator awardAggregator,
                               CoverageReportAccumulator report) {
        String entityId = entity.id();
        try (LogContext ctx = LogContext.forEntity(runId, entityId)) {
            try {
                List<CrosswalkEntry> entries = crosswalk.entriesFor(entityId);
                HazardSummary hazard = hazardAggregator.aggregate(entityId, entries, table);
                AwardSummary award = awardAggregator.aggregate(entityId, attributed.getOrDefault(entityId, List.of()));
                CoverageMetadata coverage = CoverageAssessor.assess(entries, hazard, award, catalog);

                profileWriter.write(new EntityProfile(entityId, entity.displayName(), hazard, award, coverage));

                report.recordProfileWritten();
                report.recordGeography(coverage.geography());
                if (coverage.geography() == GeographySource.FALLBACK) {
                    metrics.incrementFallbackCrosswalk();
                }
                if (award.hasAwards()) {
                    report.recordEntityWithAwards();
                }
                report.addHazardOverrides(coverage.overriddenHazards().size());
                for (MetricDefinition definition : catalog.definitions()) {
                    MetricAggregate aggregate = hazard.metrics().get(definition.name());
                    report.recordMetricCoverage(definition.name(),
                            aggregate != null ? aggregate.coverage() : MetricCoverage.NONE);
                }
            } catch (ProfileWriteException e) {
                log.error("profile.writeFailed entityId={} error={}", entityId, e.getMessage());
                report.recordEntityFailure(entityId);
            } catch (RuntimeException e) {
                log.error("profile.failed entityId={} error={}", entityId, e.getMessage(), e);
                metrics.incrementProfileFailure();
                report.recordEntityFailure(entityId);
            }
        }
    }

    public static class Builder {
        private CanonicalEntityIndex entityIndex;
        private GeographicCrosswalk crosswalk;
        private SimilarityAlgorithm similarity = new TokenSortSimilarity();
        private MetricCatalog catalog = MetricCatalog.nationalRiskIndex();
        private OverrideSource overrideSource = OverrideSource.none();
        private MetricsService metricsService = new NoOpMetricsService();
        private PipelineOptions options;
        private Clock clock = Clock.systemUTC();

        public Builder entityIndex(CanonicalEntityIndex entityIndex) {
            this.entityIndex = entityIndex;
            return this;
        }

        public Builder crosswalk(GeographicCrosswalk crosswalk) {
            this.crosswalk = crosswalk;
            return this;
        }

        /**
         * Sets the fuzzy-tier similarity; defaults to token-sort Indel similarity.
         */
        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder catalog(MetricCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder overrideSource(OverrideSource overrideSource) {
            this.overrideSource = overrideSource;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Clock for report timestamps.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws ReferenceDataException if the entity index or crosswalk is missing
         */
        public ProfilePipeline build() {
            if (entityIndex == null) {
                throw new ReferenceDataException("Canonical entity index is required");
            }
            if (crosswalk == null) {
                throw new ReferenceDataException("Geographic crosswalk is required");
            }
            if (options == null) {
                throw new IllegalStateException("Pipeline options are required");
            }
            if (similarity == null || catalog == null || overrideSource == null
                    || metricsService == null || clock == null) {
                throw new IllegalStateException("Pipeline collaborators must not be null");
            }
            return new ProfilePipeline(this);
        }
    }
}
