package com.delta.marketloader.ingest.source;

import com.delta.marketloader.ingest.model.FetchTask;
import com.delta.marketloader.ingest.model.SourceMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves one payload per task by trying sources strictly in priority order.
 *
 * <p>The identifier sent to a source is its stored mapping when one exists, otherwise
 * the task's canonical symbol. The first success wins; if that source had no mapping
 * yet, the identifier it accepted is stored as a verified mapping. An authentication
 * failure stops the fallback at once. When every source fails, the last error is
 * thrown with the earlier ones attached as suppressed exceptions.
 */
@Component
public class SourceFallbackCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SourceFallbackCoordinator.class);

    private final SourceAdapterRegistry adapters;
    private final SourceMappingStore mappings;
    private final Clock clock;

    public SourceFallbackCoordinator(SourceAdapterRegistry adapters, SourceMappingStore mappings, Clock clock) {
        this.adapters = adapters;
        this.mappings = mappings;
        this.clock = clock;
    }

    public SourcePayload resolve(FetchTask task, List<DataSource> sourcePriority) {
        if (sourcePriority == null || sourcePriority.isEmpty()) {
            throw SourceFetchException.unsupported(null, "no sources configured for " + task.symbol());
        }
        List<SourceFetchException> failures = new ArrayList<>();
        for (DataSource source : sourcePriority) {
            Optional<SourceFetchAdapter> adapter = adapters.find(source);
            if (adapter.isEmpty()) {
                failures.add(SourceFetchException.unsupported(source, "no adapter configured"));
                continue;
            }
            Optional<SourceMapping> mapping = lookupMapping(task.entityId(), source);
            String identifier = mapping.map(SourceMapping::sourceIdentifier).orElse(task.symbol());
            try {
                SourcePayload payload = adapter.get().fetch(identifier);
                rememberMapping(task, source, mapping.isPresent(), payload, identifier);
                return payload;
            } catch (SourceFetchException e) {
                log.debug("Source {} failed for {} ({}): {}", source, task.symbol(), identifier, e.getMessage());
                failures.add(e);
                if (e.getKind().abortsRun()) {
                    break;
                }
            } catch (RuntimeException e) {
                failures.add(new SourceFetchException(
                    FetchErrorKind.NETWORK,
                    source,
                    null,
                    "adapter error: " + e.getMessage(),
                    e
                ));
            }
        }
        SourceFetchException last = failures.get(failures.size() - 1);
        for (int i = 0; i < failures.size() - 1; i++) {
            last.addSuppressed(failures.get(i));
        }
        throw last;
    }

    /**
     * Identifier this task is requested with at {@code source}: the stored mapping, or the
     * canonical symbol when there is none or the lookup fails.
     */
    public String identifierFor(FetchTask task, DataSource source) {
        return lookupMapping(task.entityId(), source)
            .map(SourceMapping::sourceIdentifier)
            .orElse(task.symbol());
    }

    private Optional<SourceMapping> lookupMapping(long entityId, DataSource source) {
        try {
            return mappings.find(entityId, source);
        } catch (RuntimeException e) {
            log.warn("Mapping lookup failed for entity {} source {}: {}", entityId, source, e.getMessage());
            return Optional.empty();
        }
    }

    private void rememberMapping(
        FetchTask task,
        DataSource source,
        boolean existed,
        SourcePayload payload,
        String requestedIdentifier
    ) {
        try {
            if (existed) {
                mappings.markVerified(task.entityId(), source, clock.instant());
                return;
            }
            String resolved = payload.sourceIdentifier() == null ? requestedIdentifier : payload.sourceIdentifier();
            mappings.recordDiscovered(task.entityId(), source, resolved, clock.instant());
            log.info("Discovered {} mapping for {}: {}", source, task.symbol(), resolved);
        } catch (RuntimeException e) {
            log.warn("Failed to store {} mapping for entity {}: {}", source, task.entityId(), e.getMessage());
        }
    }
}
