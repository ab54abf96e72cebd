package com.name.suggestion.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a candidate pool cache.
 * A pool is rebuilt once its time-to-live has elapsed, so the TTL bounds how stale a
 * suggestion can be when the caller forgets to invalidate after a source change.
 *
 * @param maxPools maximum number of pools kept; the least recently used pool is evicted first
 * @param poolTtl  how long a pool is reused after it was built
 * @param enabled  whether pools are cached at all
 */
public record CacheConfig(int maxPools, Duration poolTtl, boolean enabled) {

    public CacheConfig {
        if (maxPools <= 0) {
            throw new IllegalArgumentException("maxPools must be > 0, got " + maxPools);
        }
        Objects.requireNonNull(poolTtl, "poolTtl is required");
        if (poolTtl.isZero() || poolTtl.isNegative()) {
            throw new IllegalArgumentException("poolTtl must be positive, got " + poolTtl);
        }
    }

    /**
     * Default configuration: 256 pools, each reused for 5 minutes.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(256, Duration.ofMinutes(5), true);
    }

    /**
     * Configuration that rebuilds every pool on every lookup.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }

    /**
     * Returns a copy with another pool time-to-live.
     */
    public CacheConfig withPoolTtl(Duration ttl) {
        return new CacheConfig(maxPools, ttl, enabled);
    }
}
