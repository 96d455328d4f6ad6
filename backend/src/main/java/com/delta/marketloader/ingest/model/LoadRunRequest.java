package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.identifier.SecurityType;

import java.util.List;

/**
 * Selection and per-run overrides for a quote load. Null fields fall back to configuration.
 */
public record LoadRunRequest(
    List<String> symbols,
    List<SecurityType> types,
    Integer limit,
    Boolean forceRefresh,
    Boolean cacheEnabled,
    Boolean continueOnError
) {
    public static LoadRunRequest defaults() {
        return new LoadRunRequest(List.of(), List.of(), null, null, null, null);
    }

    public LoadRunRequest {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        types = types == null ? List.of() : List.copyOf(types);
    }
}
