package com.entity.profiling.cache;

import com.entity.profiling.core.model.MatchResult;

import java.util.Optional;

/**
 * Cache of match outcomes keyed by normalized recipient name plus recipient state.
 * The state is part of the key because state validation can change the outcome
 * for the same name.
 */
public interface MatchCache {

    /**
     * Gets a cached match result.
     *
     * @param normalizedName the normalized recipient name
     * @param state          the recipient state code, or null when unknown
     * @return the cached result, or empty if not cached
     */
    Optional<MatchResult> get(String normalizedName, String state);

    void put(String normalizedName, String state, MatchResult result);

    void invalidateAll();

    CacheStats getStats();
}
