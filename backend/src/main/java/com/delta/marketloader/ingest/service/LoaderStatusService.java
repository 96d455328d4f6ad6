package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.model.ProcessRunView;
import com.delta.marketloader.ingest.model.StatusResponse;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.source.SourceAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class LoaderStatusService {
    private static final Logger log = LoggerFactory.getLogger(LoaderStatusService.class);

    private final LoaderJdbcRepository repository;
    private final SourceAdapterRegistry adapters;
    private final LoaderProperties properties;

    public LoaderStatusService(
        LoaderJdbcRepository repository,
        SourceAdapterRegistry adapters,
        LoaderProperties properties
    ) {
        this.repository = repository;
        this.adapters = adapters;
        this.properties = properties;
    }

    public StatusResponse status() {
        boolean reachable;
        Map<String, Long> counts = Map.of();
        ProcessRunView latest = null;
        try {
            reachable = repository.isDbReachable();
            counts = repository.tableCounts();
            List<ProcessRunView> runs = repository.findRecentProcessRuns(properties.getQuotes().getProcessName(), 1);
            latest = runs.isEmpty() ? null : runs.get(0);
        } catch (Exception e) {
            log.warn("Status check failed: {}", e.getMessage());
            reachable = false;
        }
        return new StatusResponse(reachable, counts, Set.copyOf(adapters.configuredSources()), latest);
    }
}
