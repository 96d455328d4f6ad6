package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.MutableClock;
import com.delta.marketloader.ingest.batch.BatchAbortedException;
import com.delta.marketloader.ingest.batch.BatchOptions;
import com.delta.marketloader.ingest.cache.CacheKeys;
import com.delta.marketloader.ingest.cache.CacheLookup;
import com.delta.marketloader.ingest.cache.CachePolicy;
import com.delta.marketloader.ingest.cache.CacheStore;
import com.delta.marketloader.ingest.cache.InMemoryCacheStore;
import com.delta.marketloader.ingest.cache.ResponseCache;
import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.model.FetchTask;
import com.delta.marketloader.ingest.model.LoadRunSummary;
import com.delta.marketloader.ingest.model.QuoteRecord;
import com.delta.marketloader.ingest.model.RunState;
import com.delta.marketloader.ingest.model.TaskOutcome;
import com.delta.marketloader.ingest.model.TaskState;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import com.delta.marketloader.ingest.source.DataSource;
import com.delta.marketloader.ingest.source.FetchErrorKind;
import com.delta.marketloader.ingest.source.InMemorySourceMappingStore;
import com.delta.marketloader.ingest.source.ScriptedSourceAdapter;
import com.delta.marketloader.ingest.source.SourceAdapterRegistry;
import com.delta.marketloader.ingest.source.SourceFallbackCoordinator;
import com.delta.marketloader.ingest.source.SourceFetchException;
import com.delta.marketloader.ingest.source.SourceMappingStore;
import com.delta.marketloader.ingest.source.SourcePayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LoaderPipelineTest {
    private static final long RUN_ID = 7L;
    private static final String PROCESS = "latest_quotes";

    @Mock
    private ProcessTracker tracker;

    @Mock
    private MissingSymbolService missingSymbols;

    @Mock
    private LoaderJdbcRepository repository;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-03T14:00:00Z"));
    private final InMemoryCacheStore store = new InMemoryCacheStore(clock);
    private final ScriptedSourceAdapter gecko = new ScriptedSourceAdapter(DataSource.COIN_GECKO);
    private final ScriptedSourceAdapter paprika = new ScriptedSourceAdapter(DataSource.COIN_PAPRIKA);
    private final RecordingLoader loader = new RecordingLoader();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        when(tracker.start(PROCESS)).thenReturn(RUN_ID);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private LoaderPipeline pipeline(CacheStore cacheStore) {
        return pipeline(cacheStore, new InMemorySourceMappingStore());
    }

    private LoaderPipeline pipeline(CacheStore cacheStore, SourceMappingStore mappings) {
        SourceFallbackCoordinator coordinator = new SourceFallbackCoordinator(
            new SourceAdapterRegistry(List.of(gecko, paprika)),
            mappings,
            clock
        );
        return new LoaderPipeline(new ResponseCache(cacheStore), coordinator, tracker, missingSymbols, executor, clock);
    }

    private LoaderPipeline pipeline() {
        return pipeline(store);
    }

    private static PipelineOptions options() {
        return new PipelineOptions(
            new BatchOptions(10, 2, Duration.ZERO, true),
            new CachePolicy(true, false, Duration.ofHours(24)),
            new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(5))
        );
    }

    private static PipelineOptions sequential(boolean continueOnError) {
        PipelineOptions base = options();
        return new PipelineOptions(new BatchOptions(1, 1, Duration.ZERO, continueOnError), base.cache(), base.retry());
    }

    private static FetchTask task(long id, String symbol, DataSource... sources) {
        return new FetchTask(id, symbol, SecurityType.CRYPTOCURRENCY, List.of(sources), "latest_quote");
    }

    private static String cacheKey(FetchTask task, DataSource source) {
        return CacheKeys.forRequest(source.key(), task.endpointTag(), task.entityId(), task.symbol());
    }

    private LatestQuoteLoader quoteLoader() {
        LoaderProperties properties = new LoaderProperties();
        LoaderProperties.Source geckoSettings = new LoaderProperties.Source();
        geckoSettings.setPricePointer("/{id}/usd");
        properties.getSources().put(DataSource.COIN_GECKO, geckoSettings);
        return new LatestQuoteLoader(repository, new BlockingPersistenceRunner(Runnable::run), properties, new ObjectMapper(), clock);
    }

    private static TaskOutcome outcomeFor(LoadRunSummary summary, String symbol) {
        return summary.outcomes().stream()
            .filter(outcome -> outcome.symbol().equals(symbol))
            .findFirst()
            .orElseThrow();
    }

    @Test
    void mappedIdentifierIsReusedWhenLoadingCachedPayload() {
        InMemorySourceMappingStore mappings = new InMemorySourceMappingStore();
        mappings.put(1, DataSource.COIN_GECKO, "bitcoin");
        gecko.alwaysReturn("{\"bitcoin\":{\"usd\":65000}}");
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        LoaderPipeline pipeline = pipeline(store, mappings);
        LatestQuoteLoader quotes = quoteLoader();

        LoadRunSummary first = pipeline.run(PROCESS, List.of(btc), quotes, options());
        LoadRunSummary second = pipeline.run(PROCESS, List.of(btc), quotes, options());

        assertFalse(outcomeFor(first, "BTC").fromCache());
        assertTrue(outcomeFor(second, "BTC").fromCache());
        assertEquals(1, second.cacheHits());
        assertEquals(1, gecko.calls());
        assertThat(gecko.requestedIdentifiers()).containsExactly("bitcoin");
        ArgumentCaptor<QuoteRecord> captor = ArgumentCaptor.forClass(QuoteRecord.class);
        verify(repository, times(2)).upsertQuote(captor.capture());
        assertThat(captor.getAllValues())
            .extracting(QuoteRecord::price)
            .allSatisfy(price -> assertEquals(0, price.compareTo(new BigDecimal("65000"))));
    }

    @Test
    void cachedPayloadIsLoadedWithoutNetworkCall() {
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        store.set(cacheKey(btc, DataSource.COIN_GECKO), "coingecko", "latest_quote", "{\"cached\":true}", Duration.ofHours(1));
        gecko.alwaysReturn("{\"fresh\":true}");

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(btc), loader, options());

        TaskOutcome outcome = outcomeFor(summary, "BTC");
        assertEquals(TaskState.SUCCEEDED, outcome.state());
        assertTrue(outcome.fromCache());
        assertEquals(0, gecko.calls());
        assertEquals(1, summary.cacheHits());
        assertThat(loader.bodies()).containsExactly("{\"cached\":true}");
        verify(tracker).complete(RUN_ID, RunState.SUCCESS, 1, 0, 0, "cache_hits=1");
    }

    @Test
    void fetchedPayloadIsCachedForTheNextRun() {
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        gecko.alwaysReturn("{\"price\":1}");
        LoaderPipeline pipeline = pipeline();

        LoadRunSummary first = pipeline.run(PROCESS, List.of(btc), loader, options());
        LoadRunSummary second = pipeline.run(PROCESS, List.of(btc), loader, options());

        assertFalse(outcomeFor(first, "BTC").fromCache());
        assertTrue(outcomeFor(second, "BTC").fromCache());
        assertEquals(1, gecko.calls());
        assertThat(store.get(cacheKey(btc, DataSource.COIN_GECKO), "coingecko"))
            .isEqualTo(CacheLookup.hit("{\"price\":1}"));
    }

    @Test
    void forceRefreshBypassesCachedPayload() {
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        store.set(cacheKey(btc, DataSource.COIN_GECKO), "coingecko", "latest_quote", "{\"stale\":true}", Duration.ofHours(1));
        gecko.alwaysReturn("{\"fresh\":true}");
        PipelineOptions base = options();
        PipelineOptions refresh = new PipelineOptions(base.batch(), base.cache().withOverrides(null, true), base.retry());

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(btc), loader, refresh);

        assertFalse(outcomeFor(summary, "BTC").fromCache());
        assertEquals(1, gecko.calls());
        assertThat(store.get(cacheKey(btc, DataSource.COIN_GECKO), "coingecko").payload()).isEqualTo("{\"fresh\":true}");
    }

    @Test
    void retryableFailureIsRetriedUntilSuccess() {
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        gecko.thenFail(FetchErrorKind.RATE_LIMITED).alwaysReturn("{\"price\":1}");

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(btc), loader, options());

        TaskOutcome outcome = outcomeFor(summary, "BTC");
        assertEquals(TaskState.SUCCEEDED, outcome.state());
        assertEquals(2, outcome.attempts());
        assertEquals(DataSource.COIN_GECKO, outcome.source());
        assertEquals(RunState.SUCCESS, summary.state());
    }

    @Test
    void retriesStopAfterConfiguredLimit() {
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        gecko.alwaysFail(FetchErrorKind.NETWORK);

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(btc), loader, options());

        TaskOutcome outcome = outcomeFor(summary, "BTC");
        assertEquals(TaskState.FAILED, outcome.state());
        assertEquals(FetchErrorKind.NETWORK, outcome.errorKind());
        assertEquals(3, outcome.attempts());
        assertEquals(3, gecko.calls());
        assertEquals(RunState.FAILED, summary.state());
        verify(tracker).complete(RUN_ID, RunState.FAILED, 0, 1, 0, "cache_hits=0");
    }

    @Test
    void dataIntegrityFailureIsNotRetriedOrCached() {
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        gecko.alwaysReturn(RecordingLoader.CORRUPT);

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(btc), loader, options());

        TaskOutcome outcome = outcomeFor(summary, "BTC");
        assertEquals(TaskState.FAILED, outcome.state());
        assertEquals(FetchErrorKind.DATA_INTEGRITY, outcome.errorKind());
        assertEquals(1, gecko.calls());
        assertFalse(store.get(cacheKey(btc, DataSource.COIN_GECKO), "coingecko").hit());
    }

    @Test
    void skippedTasksNeverReachTheNetwork() {
        FetchTask skipped = task(1, "SKIP-ME", DataSource.COIN_GECKO);
        FetchTask eth = task(2, "ETH", DataSource.COIN_PAPRIKA);
        paprika.alwaysReturn("{\"price\":2}");

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(skipped, eth), loader, options());

        assertEquals(TaskState.SKIPPED, outcomeFor(summary, "SKIP-ME").state());
        assertEquals(0, gecko.calls());
        assertEquals(1, summary.skipped());
        assertEquals(RunState.SUCCESS, summary.state());
        verify(tracker).complete(RUN_ID, RunState.SUCCESS, 1, 0, 1, "cache_hits=0");
    }

    @Test
    void sourcesWithoutAdaptersSkipTheTask() {
        FetchTask sol = task(3, "SOL", DataSource.COIN_MARKET_CAP, DataSource.SOSO_VALUE);

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(sol), loader, options());

        TaskOutcome outcome = outcomeFor(summary, "SOL");
        assertEquals(TaskState.SKIPPED, outcome.state());
        assertEquals(FetchErrorKind.UNSUPPORTED, outcome.errorKind());
    }

    @Test
    void mixedResultsCompleteWithErrorsAndRecordMissingSymbol() {
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        FetchTask nope = task(2, "NOPE", DataSource.COIN_PAPRIKA);
        gecko.alwaysReturn("{\"price\":1}");
        paprika.alwaysFail(FetchErrorKind.NOT_FOUND);

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(btc, nope), loader, options());

        assertEquals(RunState.COMPLETED_WITH_ERRORS, summary.state());
        assertEquals(1, summary.succeeded());
        assertEquals(1, summary.failed());
        assertEquals(1, paprika.calls());
        verify(missingSymbols).record(nope, List.of(DataSource.COIN_PAPRIKA));
        verify(missingSymbols, never()).record(eq(btc), anyList());
    }

    @Test
    void authenticationFailureAbortsTheRun() {
        FetchTask first = task(1, "BTC", DataSource.COIN_GECKO);
        FetchTask second = task(2, "ETH", DataSource.COIN_PAPRIKA);
        gecko.alwaysFail(FetchErrorKind.AUTH_FAILURE);
        paprika.alwaysReturn("{\"price\":2}");

        LoadRunSummary summary = pipeline().run(PROCESS, List.of(first, second), loader, sequential(true));

        assertTrue(summary.aborted());
        assertEquals(RunState.FAILED, summary.state());
        assertEquals(1, gecko.calls());
        assertEquals(0, paprika.calls());
        assertEquals(FetchErrorKind.AUTH_FAILURE, outcomeFor(summary, "BTC").errorKind());
        assertEquals(LoaderPipeline.RUN_ABORTED, outcomeFor(summary, "ETH").message());
        verify(tracker).complete(RUN_ID, RunState.FAILED, 0, 2, 0, "aborted: authentication failure");
    }

    @Test
    void firstFailurePropagatesWhenNotContinuingOnError() {
        FetchTask nope = task(1, "NOPE", DataSource.COIN_PAPRIKA);
        FetchTask btc = task(2, "BTC", DataSource.COIN_GECKO);
        paprika.alwaysFail(FetchErrorKind.NOT_FOUND);
        gecko.alwaysReturn("{\"price\":1}");

        assertThatThrownBy(() -> pipeline().run(PROCESS, List.of(nope, btc), loader, sequential(false)))
            .isInstanceOf(BatchAbortedException.class);

        assertEquals(0, gecko.calls());
        verify(tracker).complete(eq(RUN_ID), eq(RunState.FAILED), anyInt(), eq(1), anyInt(), startsWith("aborted after first failure"));
    }

    @Test
    void cacheStoreErrorsDoNotFailTasks() {
        CacheStore broken = new CacheStore() {
            @Override
            public CacheLookup get(String cacheKey, String source) {
                throw new IllegalStateException("cache table missing");
            }

            @Override
            public void set(String cacheKey, String source, String endpointTag, String payload, Duration ttl) {
                throw new IllegalStateException("cache table missing");
            }

            @Override
            public int cleanupExpired(String source) {
                return 0;
            }
        };
        FetchTask btc = task(1, "BTC", DataSource.COIN_GECKO);
        gecko.alwaysReturn("{\"price\":1}");

        LoadRunSummary summary = pipeline(broken).run(PROCESS, List.of(btc), loader, options());

        assertEquals(TaskState.SUCCEEDED, outcomeFor(summary, "BTC").state());
        assertEquals(RunState.SUCCESS, summary.state());
    }

    @Test
    void emptyRunSucceeds() {
        LoadRunSummary summary = pipeline().run(PROCESS, List.of(), loader, options());

        assertEquals(RunState.SUCCESS, summary.state());
        assertEquals(0, summary.attempted());
        verify(tracker).complete(RUN_ID, RunState.SUCCESS, 0, 0, 0, "cache_hits=0");
    }

    private static final class RecordingLoader implements PayloadLoader {
        static final String CORRUPT = "not-json";

        private final List<String> bodies = new CopyOnWriteArrayList<>();

        @Override
        public void load(FetchTask task, SourcePayload payload) {
            if (CORRUPT.equals(payload.body())) {
                throw SourceFetchException.dataIntegrity(payload.source(), "unparseable payload", null);
            }
            bodies.add(payload.body());
        }

        @Override
        public Optional<String> skipReason(FetchTask task) {
            return task.symbol().startsWith("SKIP") ? Optional.of("unsupported_type:TEST") : Optional.empty();
        }

        List<String> bodies() {
            return bodies;
        }
    }
}
