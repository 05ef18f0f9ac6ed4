package com.entity.profiling.pipeline;

import com.entity.profiling.award.FiscalYearRange;
import com.entity.profiling.cache.CacheConfig;
import com.entity.profiling.hazard.AggregationOptions;
import com.entity.profiling.matching.MatcherOptions;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for a profile run.
 */
public class PipelineOptions {

    public static final String PROFILES_DIR = "profiles";

    private final Path outputDir;
    private final MatcherOptions matcherOptions;
    private final AggregationOptions aggregationOptions;
    private final CacheConfig cacheConfig;
    private final FiscalYearRange fiscalYearRange;
    private final int parallelism;

    private PipelineOptions(Builder builder) {
        this.outputDir = builder.outputDir;
        this.matcherOptions = builder.matcherOptions;
        this.aggregationOptions = builder.aggregationOptions;
        this.cacheConfig = builder.cacheConfig;
        this.fiscalYearRange = builder.fiscalYearRange;
        this.parallelism = builder.parallelism;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default options writing to the given directory.
     */
    public static PipelineOptions defaults(Path outputDir) {
        return builder().outputDir(outputDir).build();
    }

    /**
     * Run output root; profiles go to {@code <outputDir>/profiles}, reports to the root.
     */
    public Path getOutputDir() {
        return outputDir;
    }

    public Path getProfilesDir() {
        return outputDir.resolve(PROFILES_DIR);
    }

    public MatcherOptions getMatcherOptions() {
        return matcherOptions;
    }

    public AggregationOptions getAggregationOptions() {
        return aggregationOptions;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Fiscal years for award breakdowns; null means the span of the run's award records.
     */
    public FiscalYearRange getFiscalYearRange() {
        return fiscalYearRange;
    }

    /**
     * Number of worker threads computing entity profiles; 1 runs sequentially.
     */
    public int getParallelism() {
        return parallelism;
    }

    public static class Builder {
        private Path outputDir;
        private MatcherOptions matcherOptions = MatcherOptions.defaults();
        private AggregationOptions aggregationOptions = AggregationOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private FiscalYearRange fiscalYearRange;
        private int parallelism = 1;

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder matcherOptions(MatcherOptions matcherOptions) {
            this.matcherOptions = Objects.requireNonNull(matcherOptions);
            return this;
        }

        public Builder aggregationOptions(AggregationOptions aggregationOptions) {
            this.aggregationOptions = Objects.requireNonNull(aggregationOptions);
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig);
            return this;
        }

        public Builder fiscalYearRange(FiscalYearRange range) {
            this.fiscalYearRange = range;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1");
            }
            this.parallelism = parallelism;
            return this;
        }

        public PipelineOptions build() {
            Objects.requireNonNull(outputDir, "outputDir is required");
            return new PipelineOptions(this);
        }
    }
}
