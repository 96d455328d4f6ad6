package com.delta.marketloader.ingest.api;

import com.delta.marketloader.ingest.identifier.IdentifierCodec;
import com.delta.marketloader.ingest.identifier.SecurityIdentifier;
import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.model.CacheCleanupResponse;
import com.delta.marketloader.ingest.model.IdentifierView;
import com.delta.marketloader.ingest.model.LoadRunRequest;
import com.delta.marketloader.ingest.model.LoadRunSummary;
import com.delta.marketloader.ingest.model.MappingCoverage;
import com.delta.marketloader.ingest.model.MappingDiscoveryResult;
import com.delta.marketloader.ingest.model.MissingSymbolEntry;
import com.delta.marketloader.ingest.model.ProcessRunView;
import com.delta.marketloader.ingest.model.SecurityIngestionSummary;
import com.delta.marketloader.ingest.model.SourceMappingView;
import com.delta.marketloader.ingest.model.StatusResponse;
import com.delta.marketloader.ingest.service.CacheMaintenanceService;
import com.delta.marketloader.ingest.service.LoaderStatusService;
import com.delta.marketloader.ingest.service.MissingSymbolService;
import com.delta.marketloader.ingest.service.ProcessTracker;
import com.delta.marketloader.ingest.service.QuoteLoadService;
import com.delta.marketloader.ingest.service.SecurityUniverseService;
import com.delta.marketloader.ingest.service.SourceMappingService;
import com.delta.marketloader.ingest.source.DataSource;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class LoaderController {
    private final SecurityUniverseService universeService;
    private final QuoteLoadService quoteLoadService;
    private final ProcessTracker processTracker;
    private final CacheMaintenanceService cacheMaintenanceService;
    private final MissingSymbolService missingSymbolService;
    private final LoaderStatusService statusService;
    private final SourceMappingService mappingService;

    public LoaderController(
        SecurityUniverseService universeService,
        QuoteLoadService quoteLoadService,
        ProcessTracker processTracker,
        CacheMaintenanceService cacheMaintenanceService,
        MissingSymbolService missingSymbolService,
        LoaderStatusService statusService,
        SourceMappingService mappingService
    ) {
        this.universeService = universeService;
        this.quoteLoadService = quoteLoadService;
        this.processTracker = processTracker;
        this.cacheMaintenanceService = cacheMaintenanceService;
        this.missingSymbolService = missingSymbolService;
        this.statusService = statusService;
        this.mappingService = mappingService;
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.status();
    }

    @PostMapping("/securities/ingest")
    public SecurityIngestionSummary ingestSecurities(
        @RequestParam(name = "path", required = false) String path
    ) {
        return path == null || path.isBlank() ? universeService.ingest() : universeService.ingest(path);
    }

    @GetMapping("/identifiers/{sid}")
    public IdentifierView decodeIdentifier(@PathVariable("sid") long sid) {
        SecurityIdentifier identifier = IdentifierCodec.decode(sid);
        return new IdentifierView(sid, identifier.type(), identifier.type().displayName(), identifier.sequence());
    }

    @PostMapping("/loads/quotes")
    public LoadRunSummary loadQuotes(@RequestBody(required = false) LoadRunApiRequest request) {
        return quoteLoadService.run(toRunRequest(request));
    }

    @PostMapping("/loads/quotes/async")
    public Map<String, Object> loadQuotesAsync(@RequestBody(required = false) LoadRunApiRequest request) {
        long runId = quoteLoadService.startAsync(toRunRequest(request));
        return Map.of("runId", runId, "status", "RUNNING");
    }

    @GetMapping("/runs")
    public List<ProcessRunView> recentRuns(
        @RequestParam(name = "process", required = false) String process,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        return processTracker.recent(process == null || process.isBlank() ? null : process, limit);
    }

    @GetMapping("/runs/{id}")
    public ProcessRunView run(@PathVariable("id") long id) {
        return processTracker.find(id)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "run not found: " + id));
    }

    @PostMapping("/cache/cleanup")
    public CacheCleanupResponse cleanupCache(@RequestParam(name = "source", required = false) String source) {
        if (source == null || source.isBlank()) {
            return cacheMaintenanceService.cleanupAll();
        }
        return cacheMaintenanceService.cleanup(requireSource(source));
    }

    @GetMapping("/missing-symbols")
    public List<MissingSymbolEntry> missingSymbols(
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return missingSymbolService.recent(limit);
    }

    @GetMapping("/mappings")
    public List<SourceMappingView> mappings(
        @RequestParam(name = "source", required = false) String source,
        @RequestParam(name = "limit", required = false, defaultValue = "100") int limit
    ) {
        return mappingService.list(source == null || source.isBlank() ? null : requireSource(source), limit);
    }

    @PostMapping("/mappings")
    public SourceMappingView upsertMapping(@RequestBody MappingUpsertApiRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        SecurityType type = request.type() == null || request.type().isBlank()
            ? null
            : SecurityType.fromLabel(request.type());
        return mappingService.upsert(request.symbol(), type, requireSource(request.source()), request.sourceIdentifier());
    }

    @PostMapping("/mappings/discover")
    public MappingDiscoveryResult discoverMappings(
        @RequestParam(name = "source") String source,
        @RequestParam(name = "symbols", required = false) List<String> symbols,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return mappingService.discover(requireSource(source), symbols == null ? List.of() : symbols, limit);
    }

    @GetMapping("/mappings/coverage")
    public List<MappingCoverage> mappingCoverage() {
        return mappingService.coverage();
    }

    private static DataSource requireSource(String source) {
        DataSource dataSource = source == null ? null : DataSource.fromKey(source);
        if (dataSource == null) {
            throw new ResponseStatusException(BAD_REQUEST, "unknown source: " + source);
        }
        return dataSource;
    }

    private LoadRunRequest toRunRequest(LoadRunApiRequest request) {
        if (request == null) {
            return LoadRunRequest.defaults();
        }
        List<SecurityType> types = request.types() == null
            ? List.of()
            : request.types().stream().map(SecurityType::fromLabel).distinct().toList();
        return new LoadRunRequest(
            request.symbols(),
            types,
            request.limit(),
            request.forceRefresh(),
            request.cacheEnabled(),
            request.continueOnError()
        );
    }
}
