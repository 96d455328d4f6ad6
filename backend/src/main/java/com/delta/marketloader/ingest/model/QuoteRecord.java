package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.source.DataSource;

import java.math.BigDecimal;
import java.time.Instant;

public record QuoteRecord(
    long sid,
    DataSource source,
    BigDecimal price,
    Instant quotedAt,
    Instant loadedAt
) {
}
