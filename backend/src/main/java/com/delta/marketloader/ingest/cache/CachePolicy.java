package com.delta.marketloader.ingest.cache;

import com.delta.marketloader.config.LoaderProperties;

import java.time.Duration;

public record CachePolicy(boolean enabled, boolean forceRefresh, Duration ttl) {

    public static CachePolicy from(LoaderProperties.Cache cache) {
        return new CachePolicy(cache.isEnabled(), cache.isForceRefresh(), Duration.ofHours(cache.getTtlHours()));
    }

    public CachePolicy withOverrides(Boolean enabledOverride, Boolean forceRefreshOverride) {
        return new CachePolicy(
            enabledOverride == null ? enabled : enabledOverride,
            forceRefreshOverride == null ? forceRefresh : forceRefreshOverride,
            ttl
        );
    }

    public boolean readsAllowed() {
        return enabled && !forceRefresh;
    }
}
