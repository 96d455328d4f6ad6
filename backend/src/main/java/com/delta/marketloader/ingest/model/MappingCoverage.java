package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.source.DataSource;

public record MappingCoverage(
    DataSource source,
    long securities,
    long mapped,
    long verified,
    double coveragePercent
) {
}
