package com.delta.marketloader.ingest.api;

public record MappingUpsertApiRequest(
    String symbol,
    String type,
    String source,
    String sourceIdentifier
) {
}
