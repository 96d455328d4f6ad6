package com.delta.marketloader.ingest.source;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.http.RateLimitedHttpClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class SourceAdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceAdapterRegistry.class);

    private final Map<DataSource, SourceFetchAdapter> adapters = new EnumMap<>(DataSource.class);

    @Autowired
    public SourceAdapterRegistry(
        LoaderProperties properties,
        RateLimitedHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        properties.getSources().forEach((source, settings) -> {
            if (settings == null || !settings.isEnabled()) {
                return;
            }
            if (settings.getUrlTemplate() == null || settings.getUrlTemplate().isBlank()) {
                log.warn("Source {} is enabled but has no url-template; skipping", source);
                return;
            }
            adapters.put(source, new HttpSourceAdapter(source, settings, httpClient, objectMapper));
        });
        log.info("Configured data sources: {}", adapters.keySet());
    }

    public SourceAdapterRegistry(Collection<? extends SourceFetchAdapter> adapters) {
        for (SourceFetchAdapter adapter : adapters) {
            this.adapters.put(adapter.source(), adapter);
        }
    }

    public Optional<SourceFetchAdapter> find(DataSource source) {
        return Optional.ofNullable(source == null ? null : adapters.get(source));
    }

    public Set<DataSource> configuredSources() {
        return adapters.keySet();
    }
}
