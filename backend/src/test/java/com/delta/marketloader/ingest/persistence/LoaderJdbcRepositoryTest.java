package com.delta.marketloader.ingest.persistence;

import com.delta.marketloader.ingest.identifier.IdentifierCodec;
import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.model.MissingSymbolEntry;
import com.delta.marketloader.ingest.model.ProcessRunView;
import com.delta.marketloader.ingest.model.QuoteRecord;
import com.delta.marketloader.ingest.model.RunState;
import com.delta.marketloader.ingest.model.SecurityRecord;
import com.delta.marketloader.ingest.model.SourceMapping;
import com.delta.marketloader.ingest.model.SourceMappingView;
import com.delta.marketloader.ingest.source.DataSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class LoaderJdbcRepositoryTest {

    @Autowired
    private LoaderJdbcRepository repository;

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @Test
    void cacheEntryIsUpsertedAndExpires() {
        String key = "key-" + suffix();
        Instant now = now();

        repository.upsertCacheEntry(key, "coingecko", "latest_quote", "{\"v\":1}", 200, now, now.plusSeconds(3600));
        repository.upsertCacheEntry(key, "coingecko", "latest_quote", "{\"v\":2}", 200, now, now.plusSeconds(3600));

        assertThat(repository.findLiveCacheEntry(key, "coingecko", now)).contains("{\"v\":2}");
        assertThat(repository.findLiveCacheEntry(key, "coinpaprika", now)).isEmpty();
        assertThat(repository.findLiveCacheEntry(key, "coingecko", now.plusSeconds(3600))).isEmpty();
        assertThat(repository.findCacheSources()).contains("coingecko");
    }

    @Test
    void expiredCacheEntriesAreDeletedPerSource() {
        String source = "src" + suffix().toLowerCase();
        Instant now = now();
        repository.upsertCacheEntry("old-" + source, source, "latest_quote", "a", 200, now.minusSeconds(7200), now.minusSeconds(3600));
        repository.upsertCacheEntry("live-" + source, source, "latest_quote", "b", 200, now, now.plusSeconds(3600));

        assertEquals(1, repository.deleteExpiredCacheEntries(source, now));
        assertEquals(0, repository.deleteExpiredCacheEntries(source, now));
        assertThat(repository.findLiveCacheEntry("live-" + source, source, now)).contains("b");
    }

    @Test
    void sourceMappingIsInsertedOnceAndReverified() {
        long entityId = IdentifierCodec.encode(SecurityType.CRYPTOCURRENCY, Math.abs(UUID.randomUUID().getMostSignificantBits() % 1_000_000L) + 1);
        Instant first = now().minus(Duration.ofDays(1));
        Instant second = now();

        assertTrue(repository.insertSourceMappingIfAbsent(entityId, DataSource.COIN_GECKO, "bitcoin", first));
        assertFalse(repository.insertSourceMappingIfAbsent(entityId, DataSource.COIN_GECKO, "btc", second));
        repository.touchSourceMapping(entityId, DataSource.COIN_GECKO, second);

        Optional<SourceMapping> mapping = repository.findSourceMapping(entityId, DataSource.COIN_GECKO);
        assertThat(mapping).isPresent();
        assertEquals("bitcoin", mapping.get().sourceIdentifier());
        assertTrue(mapping.get().verified());
        assertEquals(second, mapping.get().lastVerifiedAt());
        assertThat(repository.findSourceMapping(entityId, DataSource.COIN_PAPRIKA)).isEmpty();
    }

    @Test
    void unverifiedUpsertReplacesIdentifierAndClearsVerification() {
        String s = suffix();
        long sid = IdentifierCodec.encode(SecurityType.CRYPTOCURRENCY, 700_000_000L + Math.abs(s.hashCode() % 1000));
        repository.insertSecurity(new SecurityRecord(sid, "MAP" + s, "Coin " + s, SecurityType.CRYPTOCURRENCY, null));
        Instant earlier = now().minusSeconds(600);
        Instant later = now();

        repository.insertSourceMappingIfAbsent(sid, DataSource.COIN_GECKO, "MAP" + s, earlier);
        repository.upsertUnverifiedSourceMapping(sid, DataSource.COIN_GECKO, "map-coin-" + s.toLowerCase(), later);
        repository.upsertUnverifiedSourceMapping(sid, DataSource.COIN_PAPRIKA, "map-" + s.toLowerCase(), later);

        SourceMapping gecko = repository.findSourceMapping(sid, DataSource.COIN_GECKO).orElseThrow();
        assertEquals("map-coin-" + s.toLowerCase(), gecko.sourceIdentifier());
        assertFalse(gecko.verified());
        assertThat(gecko.lastVerifiedAt()).isNull();

        List<SourceMappingView> listed = repository.findSourceMappings(DataSource.COIN_PAPRIKA, 1000).stream()
            .filter(view -> view.entityId() == sid)
            .toList();
        assertThat(listed).singleElement().satisfies(view -> {
            assertEquals("MAP" + s, view.symbol());
            assertEquals(DataSource.COIN_PAPRIKA, view.source());
            assertFalse(view.verified());
        });
    }

    @Test
    void mappingCountsSeparateVerifiedRows() {
        String s = suffix();
        long first = IdentifierCodec.encode(SecurityType.CRYPTOCURRENCY, 710_000_000L + Math.abs(s.hashCode() % 1000));
        long second = first + 1;
        long before = repository.countSourceMappings(DataSource.COIN_CAP, false);
        long verifiedBefore = repository.countSourceMappings(DataSource.COIN_CAP, true);

        repository.upsertUnverifiedSourceMapping(first, DataSource.COIN_CAP, "first-" + s, now());
        repository.upsertUnverifiedSourceMapping(second, DataSource.COIN_CAP, "second-" + s, now());
        repository.touchSourceMapping(second, DataSource.COIN_CAP, now());

        assertEquals(before + 2, repository.countSourceMappings(DataSource.COIN_CAP, false));
        assertEquals(verifiedBefore + 1, repository.countSourceMappings(DataSource.COIN_CAP, true));
    }

    @Test
    void unmappedSecuritiesExcludeMappedOnesAndOtherTypes() {
        String s = suffix();
        long base = 720_000_000L + Math.abs(s.hashCode() % 1000);
        long mapped = IdentifierCodec.encode(SecurityType.CRYPTOCURRENCY, base);
        long unmapped = IdentifierCodec.encode(SecurityType.CRYPTOCURRENCY, base + 1);
        long equity = IdentifierCodec.encode(SecurityType.EQUITY, base);
        repository.insertSecurity(new SecurityRecord(mapped, "UMA" + s, "A", SecurityType.CRYPTOCURRENCY, null));
        repository.insertSecurity(new SecurityRecord(unmapped, "UMB" + s, "B", SecurityType.CRYPTOCURRENCY, null));
        repository.insertSecurity(new SecurityRecord(equity, "UMC" + s, "C", SecurityType.EQUITY, null));
        repository.upsertUnverifiedSourceMapping(mapped, DataSource.COIN_GECKO, "uma", now());
        List<String> symbols = List.of("uma" + s.toLowerCase(), "UMB" + s, "UMC" + s);

        assertThat(repository.findUnmappedSecurities(DataSource.COIN_GECKO, List.of(SecurityType.CRYPTOCURRENCY), symbols, 10))
            .extracting(SecurityRecord::sid)
            .containsExactly(unmapped);
        assertThat(repository.findUnmappedSecurities(DataSource.COIN_PAPRIKA, List.of(SecurityType.CRYPTOCURRENCY), symbols, 10))
            .extracting(SecurityRecord::symbol)
            .containsExactly("UMA" + s, "UMB" + s);
        assertThat(repository.findUnmappedSecurities(DataSource.COIN_GECKO, List.of(), symbols, 10)).isEmpty();
    }

    @Test
    void securitiesAreCountedByType() {
        Map<SecurityType, Long> before = repository.countSecuritiesByType();
        String s = suffix();
        long sid = IdentifierCodec.encode(SecurityType.BOND, 730_000_000L + Math.abs(s.hashCode() % 1000));
        repository.insertSecurity(new SecurityRecord(sid, "BND" + s, "Bond " + s, SecurityType.BOND, null));

        Map<SecurityType, Long> after = repository.countSecuritiesByType();

        assertEquals(before.getOrDefault(SecurityType.BOND, 0L) + 1, after.get(SecurityType.BOND));
    }

    @Test
    void resolvingMissingSymbolOnlyTouchesPendingRowForThatSource() {
        String symbol = "RES" + suffix();
        repository.upsertMissingSymbol(symbol, "coingecko", now());
        repository.upsertMissingSymbol(symbol, "coinpaprika", now());

        assertEquals(1, repository.resolveMissingSymbol(symbol, "coingecko"));
        assertEquals(0, repository.resolveMissingSymbol(symbol, "coingecko"));

        List<MissingSymbolEntry> entries = repository.findMissingSymbols(500).stream()
            .filter(entry -> entry.symbol().equals(symbol))
            .toList();
        assertThat(entries).extracting(MissingSymbolEntry::source, MissingSymbolEntry::resolutionStatus)
            .containsExactlyInAnyOrder(
                tuple("coingecko", "resolved"),
                tuple("coinpaprika", "pending")
            );
    }

    @Test
    void securitiesAreFilteredBySymbolTypeAndIdentifierRange() {
        String s = suffix();
        long equityId = IdentifierCodec.encode(SecurityType.EQUITY, 900_000_000L + Math.abs(s.hashCode() % 1000));
        long etfId = IdentifierCodec.encode(SecurityType.ETF, 900_000_000L + Math.abs(s.hashCode() % 1000));
        repository.insertSecurity(new SecurityRecord(equityId, "EQ" + s, "Equity " + s, SecurityType.EQUITY, "NYSE"));
        repository.insertSecurity(new SecurityRecord(etfId, "ETF" + s, "Fund " + s, SecurityType.ETF, null));

        assertTrue(repository.securityExists("EQ" + s, SecurityType.EQUITY));
        assertFalse(repository.securityExists("EQ" + s, SecurityType.ETF));
        assertThat(repository.findSecurityIdsBetween(
            IdentifierCodec.lowerBound(SecurityType.EQUITY),
            IdentifierCodec.upperBound(SecurityType.EQUITY)
        )).contains(equityId).doesNotContain(etfId);

        List<SecurityRecord> bySymbol = repository.findSecurities(List.of("eq" + s.toLowerCase(), "ETF" + s), List.of(), 10);
        assertThat(bySymbol).extracting(SecurityRecord::sid).containsExactlyInAnyOrder(equityId, etfId);
        List<SecurityRecord> byType = repository.findSecurities(List.of("EQ" + s, "ETF" + s), List.of(SecurityType.ETF), 10);
        assertThat(byType).extracting(SecurityRecord::symbol).containsExactly("ETF" + s);
        assertThat(repository.findSecurity(etfId)).get().extracting(SecurityRecord::type).isEqualTo(SecurityType.ETF);
    }

    @Test
    void quoteIsReplacedOnReload() {
        long sid = IdentifierCodec.encode(SecurityType.EQUITY, 800_000_000L + Math.abs(suffix().hashCode() % 1000));
        Instant now = now();

        repository.upsertQuote(new QuoteRecord(sid, DataSource.ALPHA_VANTAGE, new BigDecimal("101.25"), now.minusSeconds(60), now));
        repository.upsertQuote(new QuoteRecord(sid, DataSource.ALPHA_VANTAGE, new BigDecimal("102.50"), now, now));

        QuoteRecord quote = repository.findQuote(sid).orElseThrow();
        assertThat(quote.price()).isEqualByComparingTo("102.5");
        assertEquals(DataSource.ALPHA_VANTAGE, quote.source());
        assertEquals(now, quote.quotedAt());
    }

    @Test
    void processRunLifecycleIsPersisted() {
        String process = "repo-test-" + suffix();
        Instant startedAt = now();

        long runId = repository.insertProcessRun(process, startedAt);
        Optional<ProcessRunView> active = repository.findActiveProcessRun(process, startedAt.minusSeconds(60));
        repository.completeProcessRun(runId, RunState.COMPLETED_WITH_ERRORS, startedAt.plusSeconds(5), 8, 2, 1, "cache_hits=3");

        assertThat(active).get().extracting(ProcessRunView::id).isEqualTo(runId);
        assertThat(repository.findActiveProcessRun(process, startedAt.minusSeconds(60))).isEmpty();
        ProcessRunView run = repository.findProcessRun(runId).orElseThrow();
        assertEquals(RunState.COMPLETED_WITH_ERRORS, run.state());
        assertEquals(8, run.succeededCount());
        assertEquals(2, run.failedCount());
        assertEquals(1, run.skippedCount());
        assertEquals("cache_hits=3", run.notes());
        assertThat(repository.findRecentProcessRuns(process, 5)).extracting(ProcessRunView::id).containsExactly(runId);
        assertThat(repository.findRecentProcessRuns(null, 200)).extracting(ProcessRunView::id).contains(runId);
    }

    @Test
    void staleRunningRunsAreFailed() {
        String process = "stale-test-" + suffix();
        Instant now = now();
        long stale = repository.insertProcessRun(process, now.minus(Duration.ofHours(3)));
        long fresh = repository.insertProcessRun(process + "-fresh", now);

        int updated = repository.failStaleProcessRuns(now.minus(Duration.ofHours(1)), now, "aborted_on_startup");

        assertThat(updated).isGreaterThanOrEqualTo(1);
        assertEquals(RunState.FAILED, repository.findProcessRun(stale).orElseThrow().state());
        assertEquals("aborted_on_startup", repository.findProcessRun(stale).orElseThrow().notes());
        assertEquals(RunState.RUNNING, repository.findProcessRun(fresh).orElseThrow().state());
    }

    @Test
    void missingSymbolSightingsAccumulate() {
        String symbol = "GONE" + suffix();
        Instant first = now().minusSeconds(120);
        Instant second = now();

        repository.upsertMissingSymbol(symbol, "coingecko", first);
        repository.upsertMissingSymbol(symbol, "coingecko", second);
        repository.upsertMissingSymbol(symbol, "coinpaprika", second);

        List<MissingSymbolEntry> entries = repository.findMissingSymbols(500).stream()
            .filter(entry -> entry.symbol().equals(symbol))
            .toList();
        assertEquals(2, entries.size());
        MissingSymbolEntry gecko = entries.stream().filter(e -> e.source().equals("coingecko")).findFirst().orElseThrow();
        assertEquals(2, gecko.seenCount());
        assertEquals(first, gecko.firstSeenAt());
        assertEquals(second, gecko.lastSeenAt());
        assertEquals("pending", gecko.resolutionStatus());
    }

    @Test
    void statusCountsCoverLoaderTables() {
        assertTrue(repository.isDbReachable());
        assertThat(repository.tableCounts()).containsKeys(
            "securities",
            "security_quotes",
            "source_mappings",
            "api_response_cache",
            "process_runs",
            "missing_symbols"
        );
    }
}
