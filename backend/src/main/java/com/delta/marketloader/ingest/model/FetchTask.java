package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.source.DataSource;

import java.util.List;

/**
 * One unit of loader work: fetch {@code endpointTag} data for an entity, trying
 * {@code sources} in order.
 */
public record FetchTask(
    long entityId,
    String symbol,
    SecurityType securityType,
    List<DataSource> sources,
    String endpointTag
) {
    public FetchTask {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
