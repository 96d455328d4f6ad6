package com.delta.marketloader.ingest.batch;

import com.delta.marketloader.config.LoaderProperties;

import java.time.Duration;

/**
 * Chunking and dispatch settings for one {@link ConcurrencyGate#run} call.
 * Non-positive sizes are raised to one and a null or negative delay becomes zero.
 */
public record BatchOptions(
    int batchSize,
    int maxConcurrent,
    Duration interBatchDelay,
    boolean continueOnError
) {
    public BatchOptions {
        batchSize = Math.max(1, batchSize);
        maxConcurrent = Math.max(1, maxConcurrent);
        if (interBatchDelay == null || interBatchDelay.isNegative()) {
            interBatchDelay = Duration.ZERO;
        }
    }

    public static BatchOptions from(LoaderProperties.Batch batch) {
        return new BatchOptions(
            batch.getBatchSize(),
            batch.getMaxConcurrent(),
            Duration.ofMillis(batch.getInterBatchDelayMs()),
            batch.isContinueOnError()
        );
    }

    public BatchOptions withContinueOnError(boolean value) {
        return new BatchOptions(batchSize, maxConcurrent, interBatchDelay, value);
    }
}
