package com.name.suggestion.cache;

import com.name.suggestion.ranking.Candidate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Cache of expensive-to-build candidate pools, such as every type name visible in a compilation.
 *
 * <p>A cache instance belongs to one analysis session. The caller creates it, passes it to the
 * components that need it, and invalidates it when the underlying sources change; the ranking
 * engine itself never caches.</p>
 *
 * @param <T> payload type of the cached candidates
 */
public interface CandidatePoolCache<T> {

    /**
     * Returns the pool cached under the key, building it with the loader on a miss.
     *
     * @param poolKey identifies the pool, e.g. {@code "types"} or {@code "namespaces"}
     * @param loader  builds the pool; its exceptions propagate to the caller and nothing is cached
     * @return the pool, never null
     */
    List<Candidate<T>> getOrLoad(String poolKey, Supplier<List<Candidate<T>>> loader);

    /**
     * Invalidates one pool.
     */
    void invalidate(String poolKey);

    /**
     * Invalidates every pool.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();

    /**
     * Creates the cache matching the configuration: Caffeine-backed when enabled, no-op otherwise.
     */
    static <T> CandidatePoolCache<T> create(CacheConfig config) {
        return config.enabled() ? new CaffeineCandidatePoolCache<>(config) : new NoOpCandidatePoolCache<>();
    }
}
