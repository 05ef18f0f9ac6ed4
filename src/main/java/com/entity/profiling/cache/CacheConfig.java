package com.entity.profiling.cache;

/**
 * Configuration for the match cache.
 *
 * @param maxSize maximum number of entries
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 50,000 entries, enabled.
     * Recipient names repeat heavily across award files, so a single run benefits
     * without any expiry.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
