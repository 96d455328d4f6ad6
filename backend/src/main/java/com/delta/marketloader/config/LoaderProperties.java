package com.delta.marketloader.config;

import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.source.DataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "loader")
public class LoaderProperties {
    private static final String DEFAULT_USER_AGENT = "delta-market-loader/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 20;
    private int rateLimitBackoffSeconds = 30;
    private Batch batch = new Batch();
    private Retry retry = new Retry();
    private Cache cache = new Cache();
    private Map<DataSource, Source> sources = new EnumMap<>(DataSource.class);
    private Quotes quotes = new Quotes();
    private Run run = new Run();
    private Data data = new Data();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRateLimitBackoffSeconds() {
        return Math.max(0, rateLimitBackoffSeconds);
    }

    public void setRateLimitBackoffSeconds(int rateLimitBackoffSeconds) {
        this.rateLimitBackoffSeconds = Math.max(0, rateLimitBackoffSeconds);
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Map<DataSource, Source> getSources() {
        return sources;
    }

    public void setSources(Map<DataSource, Source> sources) {
        this.sources = sources == null ? new EnumMap<>(DataSource.class) : sources;
    }

    public Source getSource(DataSource source) {
        return source == null ? null : sources.get(source);
    }

    public Quotes getQuotes() {
        return quotes;
    }

    public void setQuotes(Quotes quotes) {
        this.quotes = quotes;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Batch {
        private int batchSize = 100;
        private int maxConcurrent = 5;
        private int interBatchDelayMs = 100;
        private boolean continueOnError = true;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getMaxConcurrent() {
            return Math.max(1, maxConcurrent);
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = Math.max(1, maxConcurrent);
        }

        public int getInterBatchDelayMs() {
            return Math.max(0, interBatchDelayMs);
        }

        public void setInterBatchDelayMs(int interBatchDelayMs) {
            this.interBatchDelayMs = Math.max(0, interBatchDelayMs);
        }

        public boolean isContinueOnError() {
            return continueOnError;
        }

        public void setContinueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private int baseDelayMs = 1000;
        private int maxDelayMs = 30000;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Cache {
        private boolean enabled = true;
        private boolean forceRefresh = false;
        private int ttlHours = 24;
        private String backend = "jdbc";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isForceRefresh() {
            return forceRefresh;
        }

        public void setForceRefresh(boolean forceRefresh) {
            this.forceRefresh = forceRefresh;
        }

        public int getTtlHours() {
            return Math.max(1, ttlHours);
        }

        public void setTtlHours(int ttlHours) {
            this.ttlHours = Math.max(1, ttlHours);
        }

        public String getBackend() {
            return backend == null || backend.isBlank() ? "jdbc" : backend.trim().toLowerCase(Locale.ROOT);
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }
    }

    public static class Source {
        private boolean enabled = true;
        private String urlTemplate;
        private String apiKey;
        private String apiKeyHeader;
        private String acceptHeader = "application/json";
        private String rateLimitField;
        private String errorField;
        private String pricePointer;
        private String timestampPointer;
        private String catalogUrl;
        private String catalogPointer;
        private String catalogIdField = "id";
        private String catalogSymbolField = "symbol";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiKeyHeader() {
            return apiKeyHeader;
        }

        public void setApiKeyHeader(String apiKeyHeader) {
            this.apiKeyHeader = apiKeyHeader;
        }

        public String getAcceptHeader() {
            return acceptHeader;
        }

        public void setAcceptHeader(String acceptHeader) {
            this.acceptHeader = acceptHeader;
        }

        public String getRateLimitField() {
            return rateLimitField;
        }

        public void setRateLimitField(String rateLimitField) {
            this.rateLimitField = rateLimitField;
        }

        public String getErrorField() {
            return errorField;
        }

        public void setErrorField(String errorField) {
            this.errorField = errorField;
        }

        public String getPricePointer() {
            return pricePointer;
        }

        public void setPricePointer(String pricePointer) {
            this.pricePointer = pricePointer;
        }

        public String getTimestampPointer() {
            return timestampPointer;
        }

        public void setTimestampPointer(String timestampPointer) {
            this.timestampPointer = timestampPointer;
        }

        public String getCatalogUrl() {
            return catalogUrl;
        }

        public void setCatalogUrl(String catalogUrl) {
            this.catalogUrl = catalogUrl;
        }

        public String getCatalogPointer() {
            return catalogPointer;
        }

        public void setCatalogPointer(String catalogPointer) {
            this.catalogPointer = catalogPointer;
        }

        public String getCatalogIdField() {
            return catalogIdField == null || catalogIdField.isBlank() ? "id" : catalogIdField;
        }

        public void setCatalogIdField(String catalogIdField) {
            this.catalogIdField = catalogIdField;
        }

        public String getCatalogSymbolField() {
            return catalogSymbolField == null || catalogSymbolField.isBlank() ? "symbol" : catalogSymbolField;
        }

        public void setCatalogSymbolField(String catalogSymbolField) {
            this.catalogSymbolField = catalogSymbolField;
        }
    }

    public static class Quotes {
        private String processName = "latest_quotes";
        private List<DataSource> defaultSourcePriority = new ArrayList<>(List.of(DataSource.ALPHA_VANTAGE));
        private Map<SecurityType, List<DataSource>> sourcePriority = new EnumMap<>(SecurityType.class);
        private List<SecurityType> supportedTypes = new ArrayList<>(List.of(
            SecurityType.EQUITY,
            SecurityType.ETF,
            SecurityType.CRYPTOCURRENCY
        ));
        private int defaultLimit = 100;

        public String getProcessName() {
            return processName;
        }

        public void setProcessName(String processName) {
            this.processName = processName;
        }

        public List<DataSource> getDefaultSourcePriority() {
            return defaultSourcePriority;
        }

        public void setDefaultSourcePriority(List<DataSource> defaultSourcePriority) {
            this.defaultSourcePriority = defaultSourcePriority == null ? new ArrayList<>() : defaultSourcePriority;
        }

        public Map<SecurityType, List<DataSource>> getSourcePriority() {
            return sourcePriority;
        }

        public void setSourcePriority(Map<SecurityType, List<DataSource>> sourcePriority) {
            this.sourcePriority = sourcePriority == null ? new EnumMap<>(SecurityType.class) : sourcePriority;
        }

        public List<DataSource> priorityFor(SecurityType type) {
            List<DataSource> specific = type == null ? null : sourcePriority.get(type);
            if (specific != null && !specific.isEmpty()) {
                return specific;
            }
            return defaultSourcePriority;
        }

        public List<SecurityType> getSupportedTypes() {
            return supportedTypes;
        }

        public void setSupportedTypes(List<SecurityType> supportedTypes) {
            this.supportedTypes = supportedTypes == null ? new ArrayList<>() : supportedTypes;
        }

        public int getDefaultLimit() {
            return Math.max(1, defaultLimit);
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }
    }

    public static class Run {
        private int activeRunMinutes = 30;
        private int staleRunMinutes = 60;

        public int getActiveRunMinutes() {
            return Math.max(1, activeRunMinutes);
        }

        public void setActiveRunMinutes(int activeRunMinutes) {
            this.activeRunMinutes = Math.max(1, activeRunMinutes);
        }

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }
    }

    public static class Data {
        private String securitiesCsv = "../data/securities.csv";

        public String getSecuritiesCsv() {
            return securitiesCsv;
        }

        public void setSecuritiesCsv(String securitiesCsv) {
            this.securitiesCsv = securitiesCsv;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean ingestBeforeLoad = true;
        private boolean discoverMappings;
        private String symbols = "";
        private int limit = 50;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isIngestBeforeLoad() {
            return ingestBeforeLoad;
        }

        public void setIngestBeforeLoad(boolean ingestBeforeLoad) {
            this.ingestBeforeLoad = ingestBeforeLoad;
        }

        public boolean isDiscoverMappings() {
            return discoverMappings;
        }

        public void setDiscoverMappings(boolean discoverMappings) {
            this.discoverMappings = discoverMappings;
        }

        public String getSymbols() {
            return symbols;
        }

        public void setSymbols(String symbols) {
            this.symbols = symbols;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
