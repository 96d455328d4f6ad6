package com.delta.marketloader.ingest.cache;

import com.delta.marketloader.ingest.util.HashUtils;

import java.util.Locale;

public final class CacheKeys {
    private CacheKeys() {
    }

    public static String forRequest(String source, String endpointTag, long entityId, String symbol) {
        String normalizedSymbol = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        return HashUtils.sha256Hex(source, endpointTag, Long.toString(entityId), normalizedSymbol);
    }
}
