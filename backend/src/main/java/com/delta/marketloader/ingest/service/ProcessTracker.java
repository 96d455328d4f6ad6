package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.model.ProcessRunView;
import com.delta.marketloader.ingest.model.RunState;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persists the start and completion of loader runs in {@code process_runs}.
 * At most one run per process name may be active.
 */
@Service
public class ProcessTracker {
    private static final Logger log = LoggerFactory.getLogger(ProcessTracker.class);

    private final LoaderJdbcRepository repository;
    private final LoaderProperties properties;
    private final BlockingPersistenceRunner persistence;
    private final Clock clock;

    public ProcessTracker(
        LoaderJdbcRepository repository,
        LoaderProperties properties,
        BlockingPersistenceRunner persistence,
        Clock clock
    ) {
        this.repository = repository;
        this.properties = properties;
        this.persistence = persistence;
        this.clock = clock;
    }

    public synchronized long start(String processName) {
        Instant now = clock.instant();
        Instant activeSince = now.minus(Duration.ofMinutes(properties.getRun().getActiveRunMinutes()));
        Optional<ProcessRunView> active = persistence.call(
            () -> repository.findActiveProcessRun(processName, activeSince)
        );
        if (active.isPresent()) {
            throw new ActiveLoadRunException(
                "Process " + processName + " already running as run " + active.get().id(),
                active.get().id()
            );
        }
        long runId = persistence.call(() -> repository.insertProcessRun(processName, now));
        log.info("Started {} run {}", processName, runId);
        return runId;
    }

    public void complete(long runId, RunState state, int succeeded, int failed, int skipped, String notes) {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("Run must complete with a terminal state, got " + state);
        }
        persistence.run(() -> repository.completeProcessRun(
            runId,
            state,
            clock.instant(),
            succeeded,
            failed,
            skipped,
            notes
        ));
        log.info(
            "Completed run {} state={} succeeded={} failed={} skipped={}",
            runId,
            state,
            succeeded,
            failed,
            skipped
        );
    }

    public Optional<ProcessRunView> find(long runId) {
        return persistence.call(() -> repository.findProcessRun(runId));
    }

    public List<ProcessRunView> recent(String processName, int limit) {
        return persistence.call(() -> repository.findRecentProcessRuns(processName, limit));
    }
}
