package com.delta.marketloader.ingest.service;

import com.delta.marketloader.ingest.model.FetchTask;
import com.delta.marketloader.ingest.model.MissingSymbolEntry;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.source.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class MissingSymbolService {
    private static final Logger log = LoggerFactory.getLogger(MissingSymbolService.class);

    private final LoaderJdbcRepository repository;
    private final BlockingPersistenceRunner persistence;
    private final Clock clock;

    public MissingSymbolService(LoaderJdbcRepository repository, BlockingPersistenceRunner persistence, Clock clock) {
        this.repository = repository;
        this.persistence = persistence;
        this.clock = clock;
    }

    public void record(FetchTask task, List<DataSource> sources) {
        if (task.symbol() == null || task.symbol().isBlank()) {
            return;
        }
        Instant now = clock.instant();
        for (DataSource source : sources) {
            try {
                persistence.run(() -> repository.upsertMissingSymbol(task.symbol(), source.key(), now));
            } catch (RuntimeException e) {
                log.warn("Failed to record missing symbol {} for {}: {}", task.symbol(), source, e.getMessage());
            }
        }
    }

    public List<MissingSymbolEntry> recent(int limit) {
        return persistence.call(() -> repository.findMissingSymbols(limit));
    }
}
