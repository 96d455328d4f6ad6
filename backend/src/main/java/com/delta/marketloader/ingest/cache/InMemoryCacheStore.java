package com.delta.marketloader.ingest.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCacheStore implements CacheStore {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CacheLookup get(String cacheKey, String source) {
        Entry entry = entries.get(cacheKey);
        if (entry == null || !entry.source().equals(source)) {
            return CacheLookup.miss();
        }
        if (!entry.expiresAt().isAfter(clock.instant())) {
            return CacheLookup.miss();
        }
        return CacheLookup.hit(entry.payload());
    }

    @Override
    public void set(String cacheKey, String source, String endpointTag, String payload, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        Instant now = clock.instant();
        entries.put(cacheKey, new Entry(source, endpointTag, payload, now, now.plus(ttl)));
    }

    @Override
    public int cleanupExpired(String source) {
        Instant now = clock.instant();
        int[] removed = {0};
        entries.entrySet().removeIf(e -> {
            Entry entry = e.getValue();
            boolean expired = entry.source().equals(source) && entry.expiresAt().isBefore(now);
            if (expired) {
                removed[0]++;
            }
            return expired;
        });
        return removed[0];
    }

    int size() {
        return entries.size();
    }

    private record Entry(String source, String endpointTag, String payload, Instant cachedAt, Instant expiresAt) {
    }
}
