package com.delta.marketloader.ingest.cache;

public record CacheLookup(boolean hit, String payload) {
    private static final CacheLookup MISS = new CacheLookup(false, null);

    public static CacheLookup hit(String payload) {
        return new CacheLookup(true, payload);
    }

    public static CacheLookup miss() {
        return MISS;
    }
}
