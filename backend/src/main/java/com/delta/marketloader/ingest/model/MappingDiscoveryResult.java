package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.source.DataSource;

import java.util.List;

/**
 * Outcome of matching unmapped securities against a vendor's symbol catalog.
 */
public record MappingDiscoveryResult(
    DataSource source,
    int catalogSize,
    int candidates,
    int discovered,
    List<String> unmatchedSamples
) {
}
