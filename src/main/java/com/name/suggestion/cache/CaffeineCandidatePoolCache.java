package com.name.suggestion.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.name.suggestion.ranking.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Caffeine-backed candidate pool cache.
 * Pools are stored as immutable copies so callers cannot change a cached pool after loading it.
 */
public class CaffeineCandidatePoolCache<T> implements CandidatePoolCache<T> {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCandidatePoolCache.class);

    private final Cache<String, List<Candidate<T>>> cache;

    public CaffeineCandidatePoolCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxPools())
                .expireAfterWrite(config.poolTtl())
                .recordStats()
                .build();
        log.info("CaffeineCandidatePoolCache initialized: maxPools={}, poolTtl={}",
                config.maxPools(), config.poolTtl());
    }

    @Override
    public List<Candidate<T>> getOrLoad(String poolKey, Supplier<List<Candidate<T>>> loader) {
        Objects.requireNonNull(poolKey, "poolKey is required");
        Objects.requireNonNull(loader, "loader is required");
        return cache.get(poolKey, key -> {
            List<Candidate<T>> pool = loader.get();
            List<Candidate<T>> copy = pool == null
                    ? List.of()
                    : pool.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
            log.debug("Loaded candidate pool '{}' with {} entries", key, copy.size());
            return copy;
        });
    }

    @Override
    public void invalidate(String poolKey) {
        if (poolKey != null) {
            cache.invalidate(poolKey);
            log.debug("Invalidated candidate pool '{}'", poolKey);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all candidate pools");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.loadFailureCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
