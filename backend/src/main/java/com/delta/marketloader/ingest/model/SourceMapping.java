package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.source.DataSource;

import java.time.Instant;

public record SourceMapping(
    long entityId,
    DataSource source,
    String sourceIdentifier,
    boolean verified,
    Instant lastVerifiedAt
) {
}
