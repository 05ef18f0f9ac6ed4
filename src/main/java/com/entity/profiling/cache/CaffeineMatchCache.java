package com.entity.profiling.cache;

import com.entity.profiling.core.model.MatchResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed match cache. Safe for concurrent use by matcher workers.
 */
public class CaffeineMatchCache implements MatchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMatchCache.class);

    private final Cache<CacheKey, MatchResult> cache;

    public CaffeineMatchCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CaffeineMatchCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public Optional<MatchResult> get(String normalizedName, String state) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(normalizedName, state)));
    }

    @Override
    public void put(String normalizedName, String state, MatchResult result) {
        cache.put(new CacheKey(normalizedName, state), result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all match cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Creates the cache implementation the configuration asks for.
     */
    public static MatchCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineMatchCache(config) : new NoOpMatchCache();
    }

    record CacheKey(String normalizedName, String state) {}
}
