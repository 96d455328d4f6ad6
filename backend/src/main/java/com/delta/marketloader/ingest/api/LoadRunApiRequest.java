package com.delta.marketloader.ingest.api;

import java.util.List;

public record LoadRunApiRequest(
    List<String> symbols,
    List<String> types,
    Integer limit,
    Boolean forceRefresh,
    Boolean cacheEnabled,
    Boolean continueOnError
) {
}
