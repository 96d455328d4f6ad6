package com.delta.marketloader.ingest.batch;

import java.util.List;

public record BatchResult<T, R>(
    List<R> successes,
    List<BatchFailure<T>> failures
) {
    public static <T, R> BatchResult<T, R> empty() {
        return new BatchResult<>(List.of(), List.of());
    }

    public int total() {
        return successes.size() + failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
