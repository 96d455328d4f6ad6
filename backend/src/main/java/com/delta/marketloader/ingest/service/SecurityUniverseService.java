package com.delta.marketloader.ingest.service;

import com.delta.marketloader.config.LoaderProperties;
import com.delta.marketloader.ingest.identifier.IdGenerator;
import com.delta.marketloader.ingest.identifier.IdentifierCodec;
import com.delta.marketloader.ingest.identifier.SecurityType;
import com.delta.marketloader.ingest.model.SecurityIngestionSummary;
import com.delta.marketloader.ingest.model.SecurityRecord;
import com.delta.marketloader.ingest.persistence.LoaderJdbcRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Registers securities from a {@code symbol,name,type,exchange} CSV file. New rows get an
 * identifier from a per-type {@link IdGenerator} seeded from the identifiers already stored.
 */
@Service
public class SecurityUniverseService {
    private static final Logger log = LoggerFactory.getLogger(SecurityUniverseService.class);
    private static final int MAX_ERROR_SAMPLES = 10;

    private final LoaderProperties properties;
    private final LoaderJdbcRepository repository;

    public SecurityUniverseService(LoaderProperties properties, LoaderJdbcRepository repository) {
        this.properties = properties;
        this.repository = repository;
    }

    public SecurityIngestionSummary ingest() {
        return ingest(properties.getData().getSecuritiesCsv());
    }

    public synchronized SecurityIngestionSummary ingest(String configuredPath) {
        Path path = resolvePath(configuredPath);
        MutableCounts counts = new MutableCounts();
        ErrorCollector errors = new ErrorCollector();
        Map<SecurityType, IdGenerator> generators = new EnumMap<>(SecurityType.class);
        Map<SecurityType, Integer> insertedByType = new EnumMap<>(SecurityType.class);
        Set<String> seenInFile = new HashSet<>();

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                counts.rowsRead++;
                String symbol = normalizeSymbol(getColumn(record, "symbol", "ticker"));
                String name = normalizeText(getColumn(record, "name", "security", "company_name"));
                SecurityType type = SecurityType.fromLabel(getColumn(record, "type", "security_type", "asset_type"));
                String exchange = normalizeText(getColumn(record, "exchange"));
                if (symbol == null) {
                    counts.invalidRows++;
                    errors.add("csv row " + record.getRecordNumber() + " missing symbol");
                    continue;
                }
                if (!seenInFile.add(symbol + "|" + type.name()) || repository.securityExists(symbol, type)) {
                    counts.alreadyRegistered++;
                    continue;
                }
                IdGenerator generator = generators.computeIfAbsent(type, this::seedGenerator);
                try {
                    long sid = generator.next();
                    repository.insertSecurity(new SecurityRecord(sid, symbol, name == null ? symbol : name, type, exchange));
                    counts.inserted++;
                    insertedByType.merge(type, 1, Integer::sum);
                } catch (RuntimeException e) {
                    counts.invalidRows++;
                    errors.add("csv row " + record.getRecordNumber() + " (" + symbol + "): " + rootMessage(e));
                }
            }
        } catch (IOException e) {
            errors.add("failed to read " + path + ": " + rootMessage(e));
        }

        log.info(
            "Security ingestion complete. file={}, rows={}, inserted={}, alreadyRegistered={}, errors={}",
            path,
            counts.rowsRead,
            counts.inserted,
            counts.alreadyRegistered,
            errors.totalCount()
        );
        return new SecurityIngestionSummary(
            path.toString(),
            counts.rowsRead,
            counts.inserted,
            counts.alreadyRegistered,
            counts.invalidRows,
            Map.copyOf(insertedByType),
            errors.sampleErrors()
        );
    }

    private IdGenerator seedGenerator(SecurityType type) {
        List<Long> existing = repository.findSecurityIdsBetween(
            IdentifierCodec.lowerBound(type),
            IdentifierCodec.upperBound(type)
        );
        return new IdGenerator(type, existing);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header != null && header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header);
                    if (value == null || value.trim().isEmpty()) {
                        return null;
                    }
                    return value.trim();
                }
            }
        }
        return null;
    }

    private String normalizeSymbol(String symbol) {
        String normalized = normalizeText(symbol);
        return normalized == null ? null : normalized.toUpperCase(Locale.ROOT);
    }

    private String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replace('\u00A0', ' ').trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath == null ? "" : configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }

    private static class MutableCounts {
        private int rowsRead;
        private int inserted;
        private int alreadyRegistered;
        private int invalidRows;
    }

    private static class ErrorCollector {
        private int totalCount;
        private final List<String> sampleErrors = new ArrayList<>();

        private void add(String message) {
            totalCount++;
            if (sampleErrors.size() < MAX_ERROR_SAMPLES) {
                sampleErrors.add(message);
            }
        }

        private int totalCount() {
            return totalCount;
        }

        private List<String> sampleErrors() {
            return List.copyOf(sampleErrors);
        }
    }
}
