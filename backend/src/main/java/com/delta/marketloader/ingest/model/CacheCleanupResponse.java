package com.delta.marketloader.ingest.model;

import java.util.Map;

public record CacheCleanupResponse(Map<String, Integer> removedBySource, int totalRemoved) {
}
