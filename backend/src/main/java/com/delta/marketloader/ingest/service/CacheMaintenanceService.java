package com.delta.marketloader.ingest.service;

import com.delta.marketloader.ingest.cache.ResponseCache;
import com.delta.marketloader.ingest.model.CacheCleanupResponse;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.source.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Service
public class CacheMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(CacheMaintenanceService.class);

    private final ResponseCache cache;
    private final LoaderJdbcRepository repository;
    private final BlockingPersistenceRunner persistence;

    public CacheMaintenanceService(
        ResponseCache cache,
        LoaderJdbcRepository repository,
        BlockingPersistenceRunner persistence
    ) {
        this.cache = cache;
        this.repository = repository;
        this.persistence = persistence;
    }

    public CacheCleanupResponse cleanup(DataSource source) {
        if (source == null) {
            return cleanupAll();
        }
        int removed = cache.cleanupExpired(source.key());
        log.info("Removed {} expired cache entries for {}", removed, source);
        return new CacheCleanupResponse(Map.of(source.key(), removed), removed);
    }

    /**
     * Cleans every known source plus any source tag still present in the cache table.
     */
    public CacheCleanupResponse cleanupAll() {
        Set<String> sources = new TreeSet<>();
        for (DataSource source : DataSource.values()) {
            sources.add(source.key());
        }
        try {
            sources.addAll(persistence.call(repository::findCacheSources));
        } catch (RuntimeException e) {
            log.warn("Unable to list cached sources: {}", e.getMessage());
        }
        Map<String, Integer> removedBySource = new LinkedHashMap<>();
        int total = 0;
        for (String source : sources) {
            int removed = cache.cleanupExpired(source);
            removedBySource.put(source, removed);
            total += removed;
        }
        log.info("Removed {} expired cache entries across {} sources", total, sources.size());
        return new CacheCleanupResponse(removedBySource, total);
    }
}
