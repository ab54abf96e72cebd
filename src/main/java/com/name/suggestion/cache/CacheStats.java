package com.name.suggestion.cache;

/**
 * Pool cache counters.
 *
 * @param hitCount         lookups served by an already built pool
 * @param missCount        lookups that had to build the pool
 * @param loadFailureCount pool builds that threw; such pools are not cached
 * @param evictionCount    pools dropped for size or age
 * @param poolCount        pools currently held
 */
public record CacheStats(long hitCount, long missCount, long loadFailureCount, long evictionCount, long poolCount) {

    /**
     * Share of lookups that reused a built pool (0.0 to 1.0).
     */
    public double reuseRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Share of pool builds that failed (0.0 to 1.0).
     */
    public double loadFailureRate() {
        return missCount == 0 ? 0.0 : (double) loadFailureCount / missCount;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0);
    }
}
