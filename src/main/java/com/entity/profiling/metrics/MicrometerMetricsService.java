package com.entity.profiling.metrics;

import com.entity.profiling.core.model.MatchMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code profile.match} - Counter (tag: method)</li>
 *   <li>{@code profile.match.similarity} - DistributionSummary</li>
 *   <li>{@code profile.match.cache.hit} / {@code profile.match.cache.miss} - Counter</li>
 *   <li>{@code profile.aggregation.duration} - Timer</li>
 *   <li>{@code profile.crosswalk.fallback} - Counter</li>
 *   <li>{@code profile.hazard.override} - Counter</li>
 *   <li>{@code profile.input.malformed} - Counter (tag: source)</li>
 *   <li>{@code profile.written} / {@code profile.write.failure} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final Timer aggregationTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter fallbackCounter;
    private final Counter overrideCounter;
    private final Counter writtenCounter;
    private final Counter failureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("profile.match.similarity")
                .description("Distribution of best fuzzy scores per recipient name")
                .register(registry);
        this.aggregationTimer = Timer.builder("profile.aggregation.duration")
                .description("Duration of hazard aggregation per entity")
                .register(registry);
        this.cacheHitCounter = Counter.builder("profile.match.cache.hit")
                .description("Number of match cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("profile.match.cache.miss")
                .description("Number of match cache misses")
                .register(registry);
        this.fallbackCounter = Counter.builder("profile.crosswalk.fallback")
                .description("Number of entities profiled through a state fallback crosswalk")
                .register(registry);
        this.overrideCounter = Counter.builder("profile.hazard.override")
                .description("Number of hazard scores replaced by an override source")
                .register(registry);
        this.writtenCounter = Counter.builder("profile.written")
                .description("Number of profiles written")
                .register(registry);
        this.failureCounter = Counter.builder("profile.write.failure")
                .description("Number of entities whose profile could not be produced")
                .register(registry);
    }

    @Override
    public void recordMatch(MatchMethod method) {
        counter("match:" + method.name(), "profile.match", "method", method.name(),
                "Number of award records by match method").increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordAggregationDuration(Duration duration) {
        aggregationTimer.record(duration);
    }

    @Override
    public void incrementFallbackCrosswalk() {
        fallbackCounter.increment();
    }

    @Override
    public void incrementHazardOverride() {
        overrideCounter.increment();
    }

    @Override
    public void incrementMalformedRecord(String source) {
        counter("malformed:" + source, "profile.input.malformed", "source", source,
                "Number of input records rejected as malformed").increment();
    }

    @Override
    public void incrementProfileWritten() {
        writtenCounter.increment();
    }

    @Override
    public void incrementProfileFailure() {
        failureCounter.increment();
    }

    private Counter counter(String key, String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
