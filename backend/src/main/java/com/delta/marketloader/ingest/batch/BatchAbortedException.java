package com.delta.marketloader.ingest.batch;

/**
 * Raised by {@link ConcurrencyGate} when continue-on-error is off and an item fails.
 * The cause is the error of the first failing item.
 */
public class BatchAbortedException extends RuntimeException {
    private final transient Object failedItem;

    public BatchAbortedException(Object failedItem, Throwable cause) {
        super("Batch aborted after first failure: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.failedItem = failedItem;
    }

    public Object getFailedItem() {
        return failedItem;
    }
}
