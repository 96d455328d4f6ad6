package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fails runs left in RUNNING by a previous process that never completed them.
 */
@Component
@Order(0)
public class ProcessRunLifecycleRunner implements ApplicationRunner {
    static final String ABORTED_NOTE = "aborted_on_startup";

    private static final Logger log = LoggerFactory.getLogger(ProcessRunLifecycleRunner.class);

    private final LoaderJdbcRepository repository;
    private final LoaderProperties properties;
    private final Clock clock;

    public ProcessRunLifecycleRunner(LoaderJdbcRepository repository, LoaderProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping process run cleanup because database is unreachable");
            return;
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofMinutes(properties.getRun().getStaleRunMinutes()));
        int aborted = repository.failStaleProcessRuns(cutoff, now, ABORTED_NOTE);
        if (aborted > 0) {
            log.warn("Marked {} stale process runs started before {} as FAILED", aborted, cutoff);
        }
    }
}
