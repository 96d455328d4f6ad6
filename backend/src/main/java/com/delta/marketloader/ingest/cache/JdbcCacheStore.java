package com.delta.marketloader.ingest.cache;

import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.service.BlockingPersistenceRunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cache backed by the {@code api_response_cache} table. Every statement runs on the
 * persistence pool.
 */
public class JdbcCacheStore implements CacheStore {
    private static final int CACHED_STATUS = 200;

    private final LoaderJdbcRepository repository;
    private final BlockingPersistenceRunner persistence;
    private final Clock clock;

    public JdbcCacheStore(LoaderJdbcRepository repository, BlockingPersistenceRunner persistence, Clock clock) {
        this.repository = repository;
        this.persistence = persistence;
        this.clock = clock;
    }

    @Override
    public CacheLookup get(String cacheKey, String source) {
        Instant now = clock.instant();
        return persistence.call(() -> repository.findLiveCacheEntry(cacheKey, source, now))
            .map(CacheLookup::hit)
            .orElse(CacheLookup.miss());
    }

    @Override
    public void set(String cacheKey, String source, String endpointTag, String payload, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        Instant now = clock.instant();
        persistence.run(() -> repository.upsertCacheEntry(
            cacheKey,
            source,
            endpointTag,
            payload,
            CACHED_STATUS,
            now,
            now.plus(ttl)
        ));
    }

    @Override
    public int cleanupExpired(String source) {
        Instant now = clock.instant();
        return persistence.call(() -> repository.deleteExpiredCacheEntries(source, now));
    }
}
