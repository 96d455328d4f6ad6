package com.delta.marketloader.ingest.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link CachePolicy} in front of the configured {@link CacheStore} and
 * downgrades every store error to a miss or a no-op.
 */
@Component
public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final CacheStore store;

    public ResponseCache(CacheStore store) {
        this.store = store;
    }

    public CacheLookup get(String cacheKey, String source, CachePolicy policy) {
        if (!policy.readsAllowed()) {
            return CacheLookup.miss();
        }
        try {
            CacheLookup lookup = store.get(cacheKey, source);
            if (lookup == null) {
                return CacheLookup.miss();
            }
            log.debug("Cache {} for source={} key={}", lookup.hit() ? "hit" : "miss", source, cacheKey);
            return lookup;
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for source={} key={}; treating as miss: {}", source, cacheKey, e.getMessage());
            return CacheLookup.miss();
        }
    }

    public void set(String cacheKey, String source, String endpointTag, String payload, CachePolicy policy) {
        if (!policy.enabled() || payload == null) {
            return;
        }
        try {
            store.set(cacheKey, source, endpointTag, payload, policy.ttl());
        } catch (RuntimeException e) {
            log.warn("Cache write failed for source={} key={}: {}", source, cacheKey, e.getMessage());
        }
    }

    public int cleanupExpired(String source) {
        try {
            return store.cleanupExpired(source);
        } catch (RuntimeException e) {
            log.warn("Cache cleanup failed for source={}: {}", source, e.getMessage());
            return 0;
        }
    }
}
