package com.name.suggestion.cache;

import com.name.suggestion.ranking.Candidate;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Cache that never keeps a pool: every lookup runs the loader.
 * Used when caching is disabled; its stats count every lookup as a miss.
 */
public class NoOpCandidatePoolCache<T> implements CandidatePoolCache<T> {

    private final LongAdder loads = new LongAdder();
    private final LongAdder loadFailures = new LongAdder();

    @Override
    public List<Candidate<T>> getOrLoad(String poolKey, Supplier<List<Candidate<T>>> loader) {
        Objects.requireNonNull(poolKey, "poolKey is required");
        Objects.requireNonNull(loader, "loader is required");
        loads.increment();
        List<Candidate<T>> pool;
        try {
            pool = loader.get();
        } catch (RuntimeException e) {
            loadFailures.increment();
            throw e;
        }
        return pool == null ? List.of() : pool;
    }

    @Override
    public void invalidate(String poolKey) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(0, loads.sum(), loadFailures.sum(), 0, 0);
    }
}
