package com.delta.marketloader.ingest.source;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.http.RateLimitedHttpClient;
import com.delta.marketloader.ingest.model.HttpFetchResult;
import com.delta.marketloader.ingest.util.FetchErrorClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Template driven adapter for a JSON vendor API.
 *
 * <p>The URL template may contain {@code {id}} and {@code {apiKey}}. When an API key
 * header is configured the key is sent there instead. Responses are classified once
 * here: HTTP status first, then the configured rate-limit and error fields of a 2xx
 * JSON body.
 *
 * <p>A configured catalog URL serves {@link #symbolCatalog()}: a JSON array of coins,
 * optionally nested under {@code catalog-pointer}, read with the configured id and
 * symbol fields.
 */
public class HttpSourceAdapter implements SourceFetchAdapter {
    private static final Logger log = LoggerFactory.getLogger(HttpSourceAdapter.class);
    private static final String ID_PLACEHOLDER = "{id}";
    private static final String KEY_PLACEHOLDER = "{apiKey}";

    private final DataSource source;
    private final LoaderProperties.Source settings;
    private final RateLimitedHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpSourceAdapter(
        DataSource source,
        LoaderProperties.Source settings,
        RateLimitedHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        this.source = source;
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public DataSource source() {
        return source;
    }

    @Override
    public SourcePayload fetch(String sourceIdentifier) {
        if (sourceIdentifier == null || sourceIdentifier.isBlank()) {
            throw SourceFetchException.unsupported(source, "blank identifier");
        }
        String template = settings.getUrlTemplate();
        if (template == null || template.isBlank()) {
            throw SourceFetchException.unsupported(source, "no url template configured");
        }
        String url = expand(template, sourceIdentifier, settings.getApiKey());
        HttpFetchResult result = request(url);
        String body = result.body();
        checkBodyMarkers(body, result.statusCode());
        log.debug("Fetched {} from {} in {} ms", sourceIdentifier, source, result.duration().toMillis());
        return new SourcePayload(source, sourceIdentifier, body, result.statusCode(), redact(template, sourceIdentifier));
    }

    @Override
    public Map<String, String> symbolCatalog() {
        String catalogUrl = settings.getCatalogUrl();
        if (!hasText(catalogUrl)) {
            throw SourceFetchException.unsupported(source, "no catalog url configured");
        }
        HttpFetchResult result = request(expand(catalogUrl, "", settings.getApiKey()));
        JsonNode root;
        try {
            root = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw SourceFetchException.dataIntegrity(source, "unparseable symbol catalog", e);
        }
        JsonNode entries = hasText(settings.getCatalogPointer()) ? root.at(settings.getCatalogPointer()) : root;
        if (entries == null || !entries.isArray()) {
            throw SourceFetchException.dataIntegrity(source, "symbol catalog is not a JSON array", null);
        }
        Map<String, String> catalog = new LinkedHashMap<>();
        for (JsonNode entry : entries) {
            String symbol = text(entry.get(settings.getCatalogSymbolField()));
            String id = text(entry.get(settings.getCatalogIdField()));
            if (symbol != null && id != null) {
                catalog.putIfAbsent(symbol.toUpperCase(Locale.ROOT), id);
            }
        }
        log.info("Loaded {} catalog entries from {} in {} ms", catalog.size(), source, result.duration().toMillis());
        return catalog;
    }

    private HttpFetchResult request(String url) {
        String apiKey = settings.getApiKey();
        Map<String, String> headers = Map.of();
        if (hasText(settings.getApiKeyHeader()) && hasText(apiKey)) {
            headers = Map.of(settings.getApiKeyHeader(), apiKey);
        }
        HttpFetchResult result = httpClient.get(url, settings.getAcceptHeader(), headers);
        if (result.isTransportError()) {
            throw new SourceFetchException(
                FetchErrorClassifier.fromErrorCode(result.errorCode()),
                source,
                null,
                result.errorCode() + " " + (result.errorMessage() == null ? "" : result.errorMessage())
            );
        }
        FetchErrorKind statusKind = FetchErrorClassifier.fromHttpStatus(result.statusCode());
        if (statusKind != null) {
            throw new SourceFetchException(statusKind, source, result.statusCode(), "http_" + result.statusCode());
        }
        if (result.body() == null || result.body().isBlank()) {
            throw SourceFetchException.dataIntegrity(source, "empty response body", null);
        }
        return result;
    }

    private void checkBodyMarkers(String body, int status) {
        boolean rateLimitMarker = hasText(settings.getRateLimitField());
        boolean errorMarker = hasText(settings.getErrorField());
        if (!rateLimitMarker && !errorMarker) {
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            // unparseable bodies are reported by the loader that consumes them
            return;
        }
        if (root == null || !root.isObject()) {
            return;
        }
        if (rateLimitMarker && present(root.get(settings.getRateLimitField()))) {
            throw new SourceFetchException(
                FetchErrorKind.RATE_LIMITED,
                source,
                status,
                "rate limit marker: " + root.get(settings.getRateLimitField()).asText()
            );
        }
        if (errorMarker && present(root.get(settings.getErrorField()))) {
            throw new SourceFetchException(
                FetchErrorKind.NOT_FOUND,
                source,
                status,
                "error marker: " + root.get(settings.getErrorField()).asText()
            );
        }
    }

    private String expand(String template, String identifier, String apiKey) {
        return template
            .replace(ID_PLACEHOLDER, URLEncoder.encode(identifier.trim(), StandardCharsets.UTF_8))
            .replace(KEY_PLACEHOLDER, apiKey == null ? "" : URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
    }

    private String redact(String template, String identifier) {
        return template
            .replace(ID_PLACEHOLDER, identifier.trim())
            .replace(KEY_PLACEHOLDER, "***");
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
