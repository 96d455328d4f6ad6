package com.delta.marketloader.ingest.persistence;

import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.model.MissingSymbolEntry;
import com.delta.marketloader.ingest.model.ProcessRunView;
import com.delta.marketloader.ingest.model.QuoteRecord;
import com.delta.marketloader.ingest.model.RunState;
import com.delta.marketloader.ingest.model.SecurityRecord;
import com.delta.marketloader.ingest.model.SourceMapping;
import com.delta.marketloader.ingest.model.SourceMappingView;
import com.delta.marketloader.ingest.source.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class LoaderJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(LoaderJdbcRepository.class);
    private static final Set<String> COUNTED_TABLES = Set.of(
        "securities",
        "api_response_cache",
        "source_mappings",
        "process_runs",
        "security_quotes",
        "missing_symbols"
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public LoaderJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("securities", countTable("securities"));
        counts.put("security_quotes", countTable("security_quotes"));
        counts.put("source_mappings", countTable("source_mappings"));
        counts.put("api_response_cache", countTable("api_response_cache"));
        counts.put("process_runs", countTable("process_runs"));
        counts.put("missing_symbols", countTable("missing_symbols"));
        return counts;
    }

    public long countTable(String tableName) {
        if (!COUNTED_TABLES.contains(tableName)) {
            throw new IllegalArgumentException("Unknown table: " + tableName);
        }
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return value == null ? 0L : value;
    }

    // ---- response cache ----

    public Optional<String> findLiveCacheEntry(String cacheKey, String source, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cacheKey", cacheKey)
            .addValue("source", source)
            .addValue("now", toTimestamp(now));
        List<String> rows = jdbc.query(
            """
                SELECT response_data
                FROM api_response_cache
                WHERE cache_key = :cacheKey
                  AND api_source = :source
                  AND expires_at > :now
                """,
            params,
            (rs, rowNum) -> rs.getString("response_data")
        );
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    public void upsertCacheEntry(
        String cacheKey,
        String source,
        String endpointUrl,
        String payload,
        int statusCode,
        Instant cachedAt,
        Instant expiresAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cacheKey", cacheKey)
            .addValue("source", source)
            .addValue("endpointUrl", endpointUrl)
            .addValue("payload", payload)
            .addValue("statusCode", statusCode)
            .addValue("cachedAt", toTimestamp(cachedAt))
            .addValue("expiresAt", toTimestamp(expiresAt));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO api_response_cache (
                        cache_key, api_source, endpoint_url, response_data, status_code, cached_at, expires_at
                    )
                    VALUES (:cacheKey, :source, :endpointUrl, :payload, :statusCode, :cachedAt, :expiresAt)
                    ON CONFLICT (cache_key)
                    DO UPDATE SET
                        api_source = EXCLUDED.api_source,
                        endpoint_url = EXCLUDED.endpoint_url,
                        response_data = EXCLUDED.response_data,
                        status_code = EXCLUDED.status_code,
                        cached_at = EXCLUDED.cached_at,
                        expires_at = EXCLUDED.expires_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO api_response_cache (
                    cache_key, api_source, endpoint_url, response_data, status_code, cached_at, expires_at
                )
                KEY(cache_key)
                VALUES (:cacheKey, :source, :endpointUrl, :payload, :statusCode, :cachedAt, :expiresAt)
                """,
            params
        );
    }

    public int deleteExpiredCacheEntries(String source, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("source", source)
            .addValue("now", toTimestamp(now));
        return jdbc.update(
            """
                DELETE FROM api_response_cache
                WHERE api_source = :source
                  AND expires_at < :now
                """,
            params
        );
    }

    public List<String> findCacheSources() {
        return jdbc.getJdbcTemplate().queryForList(
            "SELECT DISTINCT api_source FROM api_response_cache ORDER BY api_source",
            String.class
        );
    }

    // ---- source mappings ----

    public Optional<SourceMapping> findSourceMapping(long entityId, DataSource source) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("entityId", entityId)
            .addValue("sourceName", source.key());
        List<SourceMapping> rows = jdbc.query(
            """
                SELECT entity_id, source_name, source_identifier, verified, last_verified_at
                FROM source_mappings
                WHERE entity_id = :entityId
                  AND source_name = :sourceName
                """,
            params,
            (rs, rowNum) -> new SourceMapping(
                rs.getLong("entity_id"),
                DataSource.fromKey(rs.getString("source_name")),
                rs.getString("source_identifier"),
                rs.getBoolean("verified"),
                toInstant(rs.getTimestamp("last_verified_at"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Inserts a verified mapping unless one already exists for the pair.
     *
     * @return true when a row was inserted
     */
    public boolean insertSourceMappingIfAbsent(
        long entityId,
        DataSource source,
        String sourceIdentifier,
        Instant verifiedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("entityId", entityId)
            .addValue("sourceName", source.key())
            .addValue("sourceIdentifier", sourceIdentifier)
            .addValue("verifiedAt", toTimestamp(verifiedAt));
        if (postgres) {
            return jdbc.update(
                """
                    INSERT INTO source_mappings (
                        entity_id, source_name, source_identifier, verified, last_verified_at, created_at, updated_at
                    )
                    VALUES (:entityId, :sourceName, :sourceIdentifier, TRUE, :verifiedAt, :verifiedAt, :verifiedAt)
                    ON CONFLICT (entity_id, source_name) DO NOTHING
                    """,
                params
            ) > 0;
        }
        if (findSourceMapping(entityId, source).isPresent()) {
            return false;
        }
        try {
            return jdbc.update(
                """
                    INSERT INTO source_mappings (
                        entity_id, source_name, source_identifier, verified, last_verified_at, created_at, updated_at
                    )
                    VALUES (:entityId, :sourceName, :sourceIdentifier, TRUE, :verifiedAt, :verifiedAt, :verifiedAt)
                    """,
                params
            ) > 0;
        } catch (DataIntegrityViolationException e) {
            log.debug("Mapping for entity {} source {} inserted concurrently", entityId, source);
            return false;
        }
    }

    public void touchSourceMapping(long entityId, DataSource source, Instant verifiedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("entityId", entityId)
            .addValue("sourceName", source.key())
            .addValue("verifiedAt", toTimestamp(verifiedAt));
        jdbc.update(
            """
                UPDATE source_mappings
                SET verified = TRUE,
                    last_verified_at = :verifiedAt,
                    updated_at = :verifiedAt
                WHERE entity_id = :entityId
                  AND source_name = :sourceName
                """,
            params
        );
    }

    /**
     * Stores an operator or catalog supplied identifier. The row is left unverified until a
     * fetch through it succeeds.
     */
    public void upsertUnverifiedSourceMapping(long entityId, DataSource source, String sourceIdentifier, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("entityId", entityId)
            .addValue("sourceName", source.key())
            .addValue("sourceIdentifier", sourceIdentifier)
            .addValue("now", toTimestamp(now));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO source_mappings (
                        entity_id, source_name, source_identifier, verified, last_verified_at, created_at, updated_at
                    )
                    VALUES (:entityId, :sourceName, :sourceIdentifier, FALSE, NULL, :now, :now)
                    ON CONFLICT (entity_id, source_name)
                    DO UPDATE SET
                        source_identifier = EXCLUDED.source_identifier,
                        verified = FALSE,
                        last_verified_at = NULL,
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            );
            return;
        }
        int updated = jdbc.update(
            """
                UPDATE source_mappings
                SET source_identifier = :sourceIdentifier,
                    verified = FALSE,
                    last_verified_at = NULL,
                    updated_at = :now
                WHERE entity_id = :entityId
                  AND source_name = :sourceName
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO source_mappings (
                        entity_id, source_name, source_identifier, verified, last_verified_at, created_at, updated_at
                    )
                    VALUES (:entityId, :sourceName, :sourceIdentifier, FALSE, NULL, :now, :now)
                    """,
                params
            );
        }
    }

    public List<SourceMappingView> findSourceMappings(DataSource source, int limit) {
        StringBuilder sql = new StringBuilder(
            """
                SELECT m.entity_id, s.symbol, m.source_name, m.source_identifier, m.verified, m.last_verified_at
                FROM source_mappings m
                LEFT JOIN securities s ON s.sid = m.entity_id
                """
        );
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, Math.min(limit, 1000)));
        if (source != null) {
            sql.append(" WHERE m.source_name = :sourceName");
            params.addValue("sourceName", source.key());
        }
        sql.append(" ORDER BY m.updated_at DESC, m.entity_id LIMIT :limit");
        return jdbc.query(
            sql.toString(),
            params,
            (rs, rowNum) -> new SourceMappingView(
                rs.getLong("entity_id"),
                rs.getString("symbol"),
                DataSource.fromKey(rs.getString("source_name")),
                rs.getString("source_identifier"),
                rs.getBoolean("verified"),
                toInstant(rs.getTimestamp("last_verified_at"))
            )
        );
    }

    public long countSourceMappings(DataSource source, boolean verifiedOnly) {
        String sql = "SELECT COUNT(*) FROM source_mappings WHERE source_name = :sourceName"
            + (verifiedOnly ? " AND verified = TRUE" : "");
        Long count = jdbc.queryForObject(sql, new MapSqlParameterSource("sourceName", source.key()), Long.class);
        return count == null ? 0L : count;
    }

    /**
     * Securities of the given types that have no mapping for {@code source}, ordered by symbol.
     */
    public List<SecurityRecord> findUnmappedSecurities(
        DataSource source,
        List<SecurityType> types,
        List<String> symbols,
        int limit
    ) {
        if (types == null || types.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder(
            """
                SELECT s.sid, s.symbol, s.name, s.security_type, s.exchange
                FROM securities s
                WHERE s.security_type IN (:types)
                  AND NOT EXISTS (
                      SELECT 1 FROM source_mappings m
                      WHERE m.entity_id = s.sid
                        AND m.source_name = :sourceName
                  )
                """
        );
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("types", types.stream().map(Enum::name).toList())
            .addValue("sourceName", source.key())
            .addValue("limit", Math.max(1, limit));
        if (symbols != null && !symbols.isEmpty()) {
            sql.append(" AND s.symbol IN (:symbols)");
            params.addValue("symbols", symbols.stream().map(s -> s.trim().toUpperCase(Locale.ROOT)).toList());
        }
        sql.append(" ORDER BY s.symbol, s.sid LIMIT :limit");
        return jdbc.query(sql.toString(), params, securityRowMapper());
    }

    // ---- securities ----

    public List<Long> findSecurityIdsBetween(long lowerBound, long upperBound) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lower", lowerBound)
            .addValue("upper", upperBound);
        return jdbc.queryForList(
            "SELECT sid FROM securities WHERE sid BETWEEN :lower AND :upper",
            params,
            Long.class
        );
    }

    public boolean securityExists(String symbol, SecurityType type) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("symbol", symbol)
            .addValue("type", type.name());
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM securities WHERE symbol = :symbol AND security_type = :type",
            params,
            Integer.class
        );
        return count != null && count > 0;
    }

    public void insertSecurity(SecurityRecord security) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sid", security.sid())
            .addValue("symbol", security.symbol())
            .addValue("name", security.name())
            .addValue("type", security.type().name())
            .addValue("exchange", security.exchange())
            .addValue("createdAt", toTimestamp(Instant.now()));
        jdbc.update(
            """
                INSERT INTO securities (sid, symbol, name, security_type, exchange, created_at)
                VALUES (:sid, :symbol, :name, :type, :exchange, :createdAt)
                """,
            params
        );
    }

    public Map<SecurityType, Long> countSecuritiesByType() {
        Map<SecurityType, Long> counts = new EnumMap<>(SecurityType.class);
        jdbc.query(
            "SELECT security_type, COUNT(*) AS total FROM securities GROUP BY security_type",
            new MapSqlParameterSource(),
            rs -> {
                counts.merge(parseSecurityType(rs.getString("security_type")), rs.getLong("total"), Long::sum);
            }
        );
        return counts;
    }

    public Optional<SecurityRecord> findSecurity(long sid) {
        List<SecurityRecord> rows = jdbc.query(
            "SELECT sid, symbol, name, security_type, exchange FROM securities WHERE sid = :sid",
            new MapSqlParameterSource("sid", sid),
            securityRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Securities ordered by symbol, optionally restricted to symbols and types.
     */
    public List<SecurityRecord> findSecurities(List<String> symbols, List<SecurityType> types, int limit) {
        StringBuilder sql = new StringBuilder(
            "SELECT sid, symbol, name, security_type, exchange FROM securities WHERE 1 = 1"
        );
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, limit));
        if (symbols != null && !symbols.isEmpty()) {
            sql.append(" AND symbol IN (:symbols)");
            params.addValue("symbols", symbols.stream().map(s -> s.trim().toUpperCase(Locale.ROOT)).toList());
        }
        if (types != null && !types.isEmpty()) {
            sql.append(" AND security_type IN (:types)");
            params.addValue("types", types.stream().map(Enum::name).toList());
        }
        sql.append(" ORDER BY symbol, sid LIMIT :limit");
        return jdbc.query(sql.toString(), params, securityRowMapper());
    }

    // ---- quotes ----

    public void upsertQuote(QuoteRecord quote) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sid", quote.sid())
            .addValue("sourceName", quote.source().key())
            .addValue("price", quote.price())
            .addValue("quotedAt", toTimestamp(quote.quotedAt()))
            .addValue("loadedAt", toTimestamp(quote.loadedAt()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO security_quotes (sid, source_name, price, quoted_at, loaded_at)
                    VALUES (:sid, :sourceName, :price, :quotedAt, :loadedAt)
                    ON CONFLICT (sid)
                    DO UPDATE SET
                        source_name = EXCLUDED.source_name,
                        price = EXCLUDED.price,
                        quoted_at = EXCLUDED.quoted_at,
                        loaded_at = EXCLUDED.loaded_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO security_quotes (sid, source_name, price, quoted_at, loaded_at)
                KEY(sid)
                VALUES (:sid, :sourceName, :price, :quotedAt, :loadedAt)
                """,
            params
        );
    }

    public Optional<QuoteRecord> findQuote(long sid) {
        List<QuoteRecord> rows = jdbc.query(
            "SELECT sid, source_name, price, quoted_at, loaded_at FROM security_quotes WHERE sid = :sid",
            new MapSqlParameterSource("sid", sid),
            (rs, rowNum) -> new QuoteRecord(
                rs.getLong("sid"),
                DataSource.fromKey(rs.getString("source_name")),
                rs.getBigDecimal("price"),
                toInstant(rs.getTimestamp("quoted_at")),
                toInstant(rs.getTimestamp("loaded_at"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    // ---- process runs ----

    public long insertProcessRun(String processName, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("processName", processName)
            .addValue("state", RunState.RUNNING.name())
            .addValue("startedAt", toTimestamp(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO process_runs (
                    process_name,
                    state,
                    started_at,
                    succeeded_count,
                    failed_count,
                    skipped_count
                )
                VALUES (:processName, :state, :startedAt, 0, 0, 0)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key != null) {
            return key.longValue();
        }
        Long id = jdbc.queryForObject(
            """
                SELECT id
                FROM process_runs
                WHERE process_name = :processName
                  AND started_at = :startedAt
                ORDER BY id DESC
                LIMIT 1
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to insert process run");
        }
        return id;
    }

    public void completeProcessRun(
        long runId,
        RunState state,
        Instant finishedAt,
        int succeeded,
        int failed,
        int skipped,
        String notes
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("state", state.name())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("succeeded", succeeded)
            .addValue("failed", failed)
            .addValue("skipped", skipped)
            .addValue("notes", notes);
        jdbc.update(
            """
                UPDATE process_runs
                SET state = :state,
                    finished_at = :finishedAt,
                    succeeded_count = :succeeded,
                    failed_count = :failed,
                    skipped_count = :skipped,
                    notes = :notes
                WHERE id = :runId
                """,
            params
        );
    }

    public Optional<ProcessRunView> findProcessRun(long runId) {
        List<ProcessRunView> rows = jdbc.query(
            """
                SELECT id, process_name, state, started_at, finished_at,
                       succeeded_count, failed_count, skipped_count, notes
                FROM process_runs
                WHERE id = :runId
                """,
            new MapSqlParameterSource("runId", runId),
            processRunRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ProcessRunView> findRecentProcessRuns(String processName, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("processName", processName)
            .addValue("limit", Math.max(1, Math.min(limit, 200)));
        return jdbc.query(
            """
                SELECT id, process_name, state, started_at, finished_at,
                       succeeded_count, failed_count, skipped_count, notes
                FROM process_runs
                WHERE (CAST(:processName AS VARCHAR(128)) IS NULL OR process_name = :processName)
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            params,
            processRunRowMapper()
        );
    }

    public Optional<ProcessRunView> findActiveProcessRun(String processName, Instant startedAfter) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("processName", processName)
            .addValue("state", RunState.RUNNING.name())
            .addValue("startedAfter", toTimestamp(startedAfter));
        List<ProcessRunView> rows = jdbc.query(
            """
                SELECT id, process_name, state, started_at, finished_at,
                       succeeded_count, failed_count, skipped_count, notes
                FROM process_runs
                WHERE process_name = :processName
                  AND state = :state
                  AND started_at >= :startedAfter
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            params,
            processRunRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int failStaleProcessRuns(Instant startedBefore, Instant finishedAt, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("running", RunState.RUNNING.name())
            .addValue("failed", RunState.FAILED.name())
            .addValue("startedBefore", toTimestamp(startedBefore))
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("notes", notes);
        return jdbc.update(
            """
                UPDATE process_runs
                SET state = :failed,
                    finished_at = :finishedAt,
                    notes = :notes
                WHERE state = :running
                  AND started_at < :startedBefore
                """,
            params
        );
    }

    // ---- missing symbols ----

    public void upsertMissingSymbol(String symbol, String source, Instant seenAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("symbol", symbol)
            .addValue("source", source)
            .addValue("seenAt", toTimestamp(seenAt))
            .addValue("status", "pending");
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO missing_symbols (
                        symbol, source, first_seen_at, last_seen_at, seen_count, resolution_status
                    )
                    VALUES (:symbol, :source, :seenAt, :seenAt, 1, :status)
                    ON CONFLICT (symbol, source)
                    DO UPDATE SET
                        last_seen_at = EXCLUDED.last_seen_at,
                        seen_count = missing_symbols.seen_count + 1
                    """,
                params
            );
            return;
        }
        int updated = jdbc.update(
            """
                UPDATE missing_symbols
                SET last_seen_at = :seenAt,
                    seen_count = seen_count + 1
                WHERE symbol = :symbol
                  AND source = :source
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO missing_symbols (
                        symbol, source, first_seen_at, last_seen_at, seen_count, resolution_status
                    )
                    VALUES (:symbol, :source, :seenAt, :seenAt, 1, :status)
                    """,
                params
            );
        }
    }

    public int resolveMissingSymbol(String symbol, String source) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("symbol", symbol)
            .addValue("source", source);
        return jdbc.update(
            """
                UPDATE missing_symbols
                SET resolution_status = 'resolved'
                WHERE symbol = :symbol
                  AND source = :source
                  AND resolution_status = 'pending'
                """,
            params
        );
    }

    public List<MissingSymbolEntry> findMissingSymbols(int limit) {
        return jdbc.query(
            """
                SELECT symbol, source, first_seen_at, last_seen_at, seen_count, resolution_status
                FROM missing_symbols
                ORDER BY last_seen_at DESC, symbol
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, Math.min(limit, 500))),
            (rs, rowNum) -> new MissingSymbolEntry(
                rs.getString("symbol"),
                rs.getString("source"),
                toInstant(rs.getTimestamp("first_seen_at")),
                toInstant(rs.getTimestamp("last_seen_at")),
                rs.getInt("seen_count"),
                rs.getString("resolution_status")
            )
        );
    }

    private RowMapper<SecurityRecord> securityRowMapper() {
        return (rs, rowNum) -> new SecurityRecord(
            rs.getLong("sid"),
            rs.getString("symbol"),
            rs.getString("name"),
            parseSecurityType(rs.getString("security_type")),
            rs.getString("exchange")
        );
    }

    private RowMapper<ProcessRunView> processRunRowMapper() {
        return (rs, rowNum) -> new ProcessRunView(
            rs.getLong("id"),
            rs.getString("process_name"),
            parseRunState(rs.getString("state")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getInt("succeeded_count"),
            rs.getInt("failed_count"),
            rs.getInt("skipped_count"),
            rs.getString("notes")
        );
    }

    private SecurityType parseSecurityType(String raw) {
        if (raw == null || raw.isBlank()) {
            return SecurityType.OTHER;
        }
        try {
            return SecurityType.valueOf(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown security_type value: {}", raw);
            return SecurityType.OTHER;
        }
    }

    private RunState parseRunState(String raw) {
        try {
            return RunState.valueOf(raw);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Unknown process run state: {}", raw);
            return RunState.FAILED;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to MERGE upserts", e);
            return false;
        }
    }
}
