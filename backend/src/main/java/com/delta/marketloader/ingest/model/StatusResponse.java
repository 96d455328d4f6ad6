package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.source.DataSource;

import java.util.Map;
import java.util.Set;

public record StatusResponse(
    boolean dbReachable,
    Map<String, Long> tableCounts,
    Set<DataSource> configuredSources,
    ProcessRunView latestRun
) {
}
