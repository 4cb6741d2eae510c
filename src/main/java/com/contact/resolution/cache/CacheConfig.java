package com.contact.resolution.cache;

/**
 * @param maxSize    maximum number of cached searches
 * @param ttlSeconds time-to-live of each entry
 * @param enabled    whether search results are cached at all
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 5,000 entries, 30s TTL, enabled. Results go stale as contacts are created,
     * so the TTL stays short.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 30, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
