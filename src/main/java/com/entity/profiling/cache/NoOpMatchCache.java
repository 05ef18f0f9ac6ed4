package com.entity.profiling.cache;

import com.entity.profiling.core.model.MatchResult;

import java.util.Optional;

/**
 * No-op cache implementation, used when caching is disabled.
 */
public class NoOpMatchCache implements MatchCache {

    @Override
    public Optional<MatchResult> get(String normalizedName, String state) {
        return Optional.empty();
    }

    @Override
    public void put(String normalizedName, String state, MatchResult result) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
