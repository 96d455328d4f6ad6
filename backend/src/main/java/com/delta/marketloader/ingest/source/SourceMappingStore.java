package com.delta.marketloader.ingest.source;

import com.delta.marketloader.ingest.model.SourceMapping;

import java.time.Instant;
import java.util.Optional;

public interface SourceMappingStore {

    Optional<SourceMapping> find(long entityId, DataSource source);

    /**
     * Persists a mapping found by a successful fetch, marked verified.
     */
    void recordDiscovered(long entityId, DataSource source, String sourceIdentifier, Instant verifiedAt);

    void markVerified(long entityId, DataSource source, Instant verifiedAt);
}
