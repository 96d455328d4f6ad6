package com.delta.marketloader.ingest.cache;

import java.time.Duration;

/**
 * TTL keyed store for raw vendor responses.
 *
 * <p>{@code set} is an upsert: a second write for the same key replaces the first.
 * {@code get} only returns entries whose expiry lies in the future.
 */
public interface CacheStore {

    CacheLookup get(String cacheKey, String source);

    void set(String cacheKey, String source, String endpointTag, String payload, Duration ttl);

    /**
     * Deletes entries of {@code source} that expired before now.
     *
     * @return number of removed entries
     */
    int cleanupExpired(String source);
}
