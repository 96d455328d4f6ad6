package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.model.FetchTask;
import com.delta.marketloader.ingest.model.LoadRunRequest;
import com.delta.marketloader.ingest.model.QuoteRecord;
import com.delta.marketloader.ingest.model.SecurityRecord;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.source.DataSource;
import com.delta.marketloader.ingest.source.SourceFetchException;
import com.delta.marketloader.ingest.source.SourcePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Loads the latest price of each registered security into {@code security_quotes}.
 *
 * <p>Each source is configured with a JSON pointer to the price and, optionally, to
 * the quote time. A {@code {id}} token in a pointer is replaced with the identifier
 * the source was queried with.
 */
@Component
public class LatestQuoteLoader implements PayloadLoader {
    public static final String ENDPOINT_TAG = "latest_quote";

    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private final LoaderJdbcRepository repository;
    private final BlockingPersistenceRunner persistence;
    private final LoaderProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LatestQuoteLoader(
        LoaderJdbcRepository repository,
        BlockingPersistenceRunner persistence,
        LoaderProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.repository = repository;
        this.persistence = persistence;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public List<FetchTask> buildTasks(LoadRunRequest request) {
        int limit = request.limit() == null ? properties.getQuotes().getDefaultLimit() : Math.max(1, request.limit());
        List<SecurityRecord> securities = persistence.call(
            () -> repository.findSecurities(request.symbols(), request.types(), limit)
        );
        return securities.stream()
            .map(security -> new FetchTask(
                security.sid(),
                security.symbol(),
                security.type(),
                properties.getQuotes().priorityFor(security.type()),
                ENDPOINT_TAG
            ))
            .toList();
    }

    @Override
    public Optional<String> skipReason(FetchTask task) {
        SecurityType type = task.securityType();
        if (type == null || !properties.getQuotes().getSupportedTypes().contains(type)) {
            return Optional.of("unsupported_type:" + type);
        }
        return Optional.empty();
    }

    @Override
    public void load(FetchTask task, SourcePayload payload) {
        DataSource source = payload.source();
        LoaderProperties.Source settings = properties.getSource(source);
        if (settings == null || settings.getPricePointer() == null || settings.getPricePointer().isBlank()) {
            throw SourceFetchException.dataIntegrity(source, "no price pointer configured", null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload.body());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw SourceFetchException.dataIntegrity(source, "unparseable payload for " + task.symbol(), e);
        }
        String identifier = payload.sourceIdentifier() == null ? task.symbol() : payload.sourceIdentifier();
        BigDecimal price = parsePrice(at(root, settings.getPricePointer(), identifier, source));
        if (price == null) {
            throw SourceFetchException.dataIntegrity(source, "missing price for " + task.symbol(), null);
        }
        Instant loadedAt = clock.instant();
        Instant quotedAt = loadedAt;
        if (settings.getTimestampPointer() != null && !settings.getTimestampPointer().isBlank()) {
            Instant parsed = parseTimestamp(at(root, settings.getTimestampPointer(), identifier, source));
            if (parsed != null) {
                quotedAt = parsed;
            }
        }
        QuoteRecord quote = new QuoteRecord(task.entityId(), source, price, quotedAt, loadedAt);
        persistence.run(() -> repository.upsertQuote(quote));
    }

    private JsonNode at(JsonNode root, String pointer, String identifier, DataSource source) {
        String expanded = pointer.replace("{id}", identifier.replace("~", "~0").replace("/", "~1"));
        try {
            return root.at(expanded);
        } catch (IllegalArgumentException e) {
            throw SourceFetchException.dataIntegrity(source, "invalid JSON pointer " + pointer, e);
        }
    }

    static BigDecimal parsePrice(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            long value = node.asLong();
            return value >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // fall through to date-only form
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
