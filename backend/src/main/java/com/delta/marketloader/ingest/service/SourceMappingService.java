package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.model.MappingCoverage;
import com.delta.marketloader.ingest.model.MappingDiscoveryResult;
import com.delta.marketloader.ingest.model.SecurityRecord;
import com.delta.marketloader.ingest.model.SourceMapping;
import com.delta.marketloader.ingest.model.SourceMappingView;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.source.DataSource;
import com.delta.marketloader.ingest.source.SourceAdapterRegistry;
import com.delta.marketloader.ingest.source.SourceFetchAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maintains the per-source identifier table that {@code SourceFallbackCoordinator} reads.
 *
 * <p>Mappings set by an operator or matched from a vendor catalog are stored unverified;
 * the first successful fetch through them marks them verified.
 */
@Service
public class SourceMappingService {
    private static final Logger log = LoggerFactory.getLogger(SourceMappingService.class);
    private static final int MAX_UNMATCHED_SAMPLES = 20;
    private static final int DEFAULT_DISCOVERY_LIMIT = 1000;

    private final LoaderJdbcRepository repository;
    private final SourceAdapterRegistry adapters;
    private final LoaderProperties properties;
    private final Clock clock;

    public SourceMappingService(
        LoaderJdbcRepository repository,
        SourceAdapterRegistry adapters,
        LoaderProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.adapters = adapters;
        this.properties = properties;
        this.clock = clock;
    }

    public SourceMappingView upsert(String symbol, SecurityType type, DataSource source, String sourceIdentifier) {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (sourceIdentifier == null || sourceIdentifier.isBlank()) {
            throw new IllegalArgumentException("sourceIdentifier is required");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        List<SecurityRecord> matches = repository.findSecurities(
            List.of(normalized),
            type == null ? List.of() : List.of(type),
            2
        );
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("unknown security: " + normalized + (type == null ? "" : " " + type));
        }
        if (matches.size() > 1) {
            throw new IllegalArgumentException("symbol " + normalized + " is registered under several types; pass type");
        }
        SecurityRecord security = matches.get(0);
        String identifier = sourceIdentifier.trim();
        Optional<SourceMapping> existing = repository.findSourceMapping(security.sid(), source);
        if (existing.isPresent() && existing.get().sourceIdentifier().equals(identifier)) {
            return toView(security, existing.get());
        }
        repository.upsertUnverifiedSourceMapping(security.sid(), source, identifier, clock.instant());
        repository.resolveMissingSymbol(security.symbol(), source.key());
        log.info("Set {} mapping for {}: {}", source, security.symbol(), identifier);
        return new SourceMappingView(security.sid(), security.symbol(), source, identifier, false, null);
    }

    /**
     * Matches securities without a mapping for {@code source} against the vendor's symbol
     * catalog and stores every match.
     */
    public MappingDiscoveryResult discover(DataSource source, List<String> symbols, Integer limit) {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        SourceFetchAdapter adapter = adapters.find(source)
            .orElseThrow(() -> new IllegalArgumentException("source not configured: " + source));
        List<SecurityType> types = typesServedBy(source);
        int max = limit == null ? DEFAULT_DISCOVERY_LIMIT : Math.max(1, limit);
        List<SecurityRecord> candidates = repository.findUnmappedSecurities(source, types, symbols, max);
        if (candidates.isEmpty()) {
            log.info("No unmapped securities for {}", source);
            return new MappingDiscoveryResult(source, 0, 0, 0, List.of());
        }

        Map<String, String> catalog = adapter.symbolCatalog();
        int discovered = 0;
        List<String> unmatched = new ArrayList<>();
        for (SecurityRecord security : candidates) {
            String identifier = catalog.get(security.symbol().toUpperCase(Locale.ROOT));
            if (identifier == null) {
                if (unmatched.size() < MAX_UNMATCHED_SAMPLES) {
                    unmatched.add(security.symbol());
                }
                continue;
            }
            repository.upsertUnverifiedSourceMapping(security.sid(), source, identifier, clock.instant());
            repository.resolveMissingSymbol(security.symbol(), source.key());
            discovered++;
            log.debug("Discovered {} mapping {} -> {}", source, security.symbol(), identifier);
        }
        log.info(
            "Discovered {} of {} missing {} mappings from a catalog of {} entries",
            discovered,
            candidates.size(),
            source,
            catalog.size()
        );
        return new MappingDiscoveryResult(source, catalog.size(), candidates.size(), discovered, List.copyOf(unmatched));
    }

    public List<MappingCoverage> coverage() {
        Map<SecurityType, Long> securitiesByType = repository.countSecuritiesByType();
        List<MappingCoverage> result = new ArrayList<>();
        for (DataSource source : DataSource.values()) {
            if (!adapters.configuredSources().contains(source)) {
                continue;
            }
            long securities = 0;
            for (SecurityType type : typesServedBy(source)) {
                securities += securitiesByType.getOrDefault(type, 0L);
            }
            long mapped = repository.countSourceMappings(source, false);
            long verified = repository.countSourceMappings(source, true);
            double percent = securities == 0 ? 0.0 : Math.round(mapped * 1000.0 / securities) / 10.0;
            result.add(new MappingCoverage(source, securities, mapped, verified, percent));
        }
        return result;
    }

    public List<SourceMappingView> list(DataSource source, int limit) {
        return repository.findSourceMappings(source, limit);
    }

    /** Sources with a symbol catalog, in enum order. */
    public List<DataSource> discoverableSources() {
        List<DataSource> sources = new ArrayList<>();
        for (DataSource source : DataSource.values()) {
            LoaderProperties.Source settings = properties.getSource(source);
            if (adapters.configuredSources().contains(source)
                && settings != null
                && settings.getCatalogUrl() != null
                && !settings.getCatalogUrl().isBlank()) {
                sources.add(source);
            }
        }
        return sources;
    }

    private List<SecurityType> typesServedBy(DataSource source) {
        LoaderProperties.Quotes quotes = properties.getQuotes();
        return quotes.getSupportedTypes().stream()
            .filter(type -> quotes.priorityFor(type).contains(source))
            .distinct()
            .toList();
    }

    private static SourceMappingView toView(SecurityRecord security, SourceMapping mapping) {
        return new SourceMappingView(
            security.sid(),
            security.symbol(),
            mapping.source(),
            mapping.sourceIdentifier(),
            mapping.verified(),
            mapping.lastVerifiedAt()
        );
    }
}
