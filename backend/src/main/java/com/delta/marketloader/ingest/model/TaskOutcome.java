package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.source.DataSource;
import com.delta.marketloader.ingest.source.FetchErrorKind;

public record TaskOutcome(
    long entityId,
    String symbol,
    TaskState state,
    DataSource source,
    boolean fromCache,
    int attempts,
    FetchErrorKind errorKind,
    String message
) {
    public static TaskOutcome succeeded(FetchTask task, DataSource source, boolean fromCache, int attempts) {
        return new TaskOutcome(task.entityId(), task.symbol(), TaskState.SUCCEEDED, source, fromCache, attempts, null, null);
    }

    public static TaskOutcome skipped(FetchTask task, String reason) {
        return new TaskOutcome(task.entityId(), task.symbol(), TaskState.SKIPPED, null, false, 0, FetchErrorKind.UNSUPPORTED, reason);
    }

    public static TaskOutcome failed(FetchTask task, int attempts, FetchErrorKind kind, String message) {
        return new TaskOutcome(task.entityId(), task.symbol(), TaskState.FAILED, null, false, attempts, kind, message);
    }
}
