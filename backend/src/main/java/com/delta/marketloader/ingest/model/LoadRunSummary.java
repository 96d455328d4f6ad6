package com.delta.marketloader.ingest.model;

import java.time.Instant;
import java.util.List;

public record LoadRunSummary(
    Long runId,
    String processName,
    RunState state,
    Instant startedAt,
    Instant finishedAt,
    int attempted,
    int succeeded,
    int failed,
    int skipped,
    int cacheHits,
    boolean aborted,
    List<TaskOutcome> outcomes
) {
}
