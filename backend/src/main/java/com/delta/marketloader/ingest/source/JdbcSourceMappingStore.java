package com.delta.marketloader.ingest.source;

import com.delta.marketloader.ingest.model.SourceMapping;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.service.BlockingPersistenceRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Component
public class JdbcSourceMappingStore implements SourceMappingStore {
    private final LoaderJdbcRepository repository;
    private final BlockingPersistenceRunner persistence;

    public JdbcSourceMappingStore(LoaderJdbcRepository repository, BlockingPersistenceRunner persistence) {
        this.repository = repository;
        this.persistence = persistence;
    }

    @Override
    public Optional<SourceMapping> find(long entityId, DataSource source) {
        return persistence.call(() -> repository.findSourceMapping(entityId, source));
    }

    @Override
    public void recordDiscovered(long entityId, DataSource source, String sourceIdentifier, Instant verifiedAt) {
        persistence.run(() -> repository.insertSourceMappingIfAbsent(entityId, source, sourceIdentifier, verifiedAt));
    }

    @Override
    public void markVerified(long entityId, DataSource source, Instant verifiedAt) {
        persistence.run(() -> repository.touchSourceMapping(entityId, source, verifiedAt));
    }
}
