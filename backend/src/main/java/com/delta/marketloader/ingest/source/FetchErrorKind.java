package com.delta.marketloader.ingest.source;

/**
 * Classification assigned to a failed vendor call at the adapter boundary.
 */
public enum FetchErrorKind {
    RATE_LIMITED(true),
    NETWORK(true),
    NOT_FOUND(false),
    UNSUPPORTED(false),
    AUTH_FAILURE(false),
    DATA_INTEGRITY(false);

    private final boolean retryable;

    FetchErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    public boolean abortsRun() {
        return this == AUTH_FAILURE;
    }
}
