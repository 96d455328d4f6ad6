package com.delta.marketloader.ingest.source;

/**
 * Raw vendor response body together with the identifier that produced it.
 */
public record SourcePayload(
    DataSource source,
    String sourceIdentifier,
    String body,
    int statusCode,
    String endpoint
) {
}
