package com.delta.marketloader.ingest.source;

import java.util.Locale;

/**
 * External data providers. Each vendor has its own tag, which is also the
 * partition key for cached responses and the {@code source_name} of persisted
 * identifier mappings.
 */
public enum DataSource {
    ALPHA_VANTAGE("alphavantage"),
    COIN_GECKO("coingecko"),
    COIN_PAPRIKA("coinpaprika"),
    COIN_CAP("coincap"),
    COIN_MARKET_CAP("coinmarketcap"),
    SOSO_VALUE("sosovalue");

    private final String key;

    DataSource(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static DataSource fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        for (DataSource source : values()) {
            if (source.key.equals(normalized)) {
                return source;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return key;
    }
}
