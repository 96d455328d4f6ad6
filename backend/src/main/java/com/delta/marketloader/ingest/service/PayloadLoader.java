package com.delta.marketloader.ingest.service;

import com.delta.marketloader.ingest.model.FetchTask;
import com.delta.marketloader.ingest.source.SourcePayload;

import java.util.Optional;

/**
 * Turns a fetched payload into persisted rows. Implementations must be idempotent:
 * a cached payload may be loaded more than once.
 */
public interface PayloadLoader {

    /**
     * Parses and persists the payload.
     *
     * @throws com.delta.marketloader.ingest.source.SourceFetchException with kind
     *     {@code DATA_INTEGRITY} when the payload cannot be decoded
     */
    void load(FetchTask task, SourcePayload payload);

    /**
     * Reason to skip a task before any network call, or empty to process it.
     */
    default Optional<String> skipReason(FetchTask task) {
        return Optional.empty();
    }
}
