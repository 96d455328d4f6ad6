package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.model.LoadRunRequest;
import com.delta.marketloader.ingest.model.LoadRunSummary;
import com.delta.marketloader.ingest.model.MappingDiscoveryResult;
import com.delta.marketloader.ingest.model.SecurityIngestionSummary;
import com.delta.marketloader.ingest.model.TaskOutcome;
import com.delta.marketloader.ingest.model.TaskState;
import com.delta.marketloader.ingest.source.DataSource;
import com.delta.marketloader.ingest.source.SourceFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
@Order(10)
public class LoaderCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(LoaderCliRunner.class);

    private final LoaderProperties properties;
    private final SecurityUniverseService universeService;
    private final QuoteLoadService quoteLoadService;
    private final SourceMappingService mappingService;
    private final ConfigurableApplicationContext applicationContext;

    public LoaderCliRunner(
        LoaderProperties properties,
        SecurityUniverseService universeService,
        QuoteLoadService quoteLoadService,
        SourceMappingService mappingService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.universeService = universeService;
        this.quoteLoadService = quoteLoadService;
        this.mappingService = mappingService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        if (properties.getCli().isIngestBeforeLoad()) {
            SecurityIngestionSummary ingestion = universeService.ingest();
            log.info("Ingested {} new securities from {}", ingestion.inserted(), ingestion.source());
        }

        String rawSymbols = properties.getCli().getSymbols() == null ? "" : properties.getCli().getSymbols();
        List<String> symbols = Arrays.stream(rawSymbols.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        if (properties.getCli().isDiscoverMappings()) {
            discoverMappings(symbols);
        }

        LoadRunRequest request = new LoadRunRequest(
            symbols,
            List.of(),
            properties.getCli().getLimit(),
            null,
            null,
            null
        );
        LoadRunSummary summary = quoteLoadService.run(request);
        log.info(
            "Quote run {} completed with state {}: succeeded={}, failed={}, skipped={}, cacheHits={}",
            summary.runId(),
            summary.state(),
            summary.succeeded(),
            summary.failed(),
            summary.skipped(),
            summary.cacheHits()
        );
        for (TaskOutcome outcome : summary.outcomes()) {
            if (outcome.state() != TaskState.SUCCEEDED) {
                log.info("  {} {}: {} {}", outcome.symbol(), outcome.state(), outcome.errorKind(), outcome.message());
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    private void discoverMappings(List<String> symbols) {
        for (DataSource source : mappingService.discoverableSources()) {
            try {
                MappingDiscoveryResult result = mappingService.discover(source, symbols, properties.getCli().getLimit());
                log.info("Mapped {} of {} securities for {}", result.discovered(), result.candidates(), source);
            } catch (SourceFetchException ex) {
                log.warn("Mapping discovery for {} failed: {}", source, ex.getMessage());
            }
        }
    }
}
