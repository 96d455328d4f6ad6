package com.delta.marketloader.ingest.model;

import java.time.Instant;

public record ProcessRunView(
    long id,
    String processName,
    RunState state,
    Instant startedAt,
    Instant finishedAt,
    int succeededCount,
    int failedCount,
    int skippedCount,
    String notes
) {
}
