package com.delta.marketloader.ingest.model;

import java.time.Instant;

public record MissingSymbolEntry(
    String symbol,
    String source,
    Instant firstSeenAt,
    Instant lastSeenAt,
    int seenCount,
    String resolutionStatus
) {
}
