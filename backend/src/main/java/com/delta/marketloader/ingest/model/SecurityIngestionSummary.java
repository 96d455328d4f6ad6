package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.identifier.SecurityType;

import java.util.List;
import java.util.Map;

public record SecurityIngestionSummary(
    String source,
    int rowsRead,
    int inserted,
    int alreadyRegistered,
    int invalidRows,
    Map<SecurityType, Integer> insertedByType,
    List<String> sampleErrors
) {
}
