package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.identifier.SecurityType;

public record SecurityRecord(
    long sid,
    String symbol,
    String name,
    SecurityType type,
    String exchange
) {
}
