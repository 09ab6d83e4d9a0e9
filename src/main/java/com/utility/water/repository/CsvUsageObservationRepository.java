package com.utility.water.repository;

import com.utility.water.config.StoreConfig;
import com.utility.water.model.Observation;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps the series in a two-column CSV table: {@code timestamp,water_usage}.
 *
 * Timestamps are written as local date-times ({@code yyyy-MM-dd HH:mm:ss}) in the
 * clock's zone. On read, ISO forms with or without an offset are accepted too. A blank,
 * non-numeric, infinite or negative usage cell is read as a missing value.
 */
@Repository
@ConditionalOnProperty(name = "water.store.type", havingValue = "csv", matchIfMissing = true)
public class CsvUsageObservationRepository implements UsageObservationRepository {

    private static final Logger log = LoggerFactory.getLogger(CsvUsageObservationRepository.class);

    static final String COL_TIMESTAMP = "timestamp";
    static final String COL_USAGE = "water_usage";

    private static final DateTimeFormatter LOCAL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // "2026-10-18 10:00:00", "2026-10-18T10:00", "2026-10-18T10:00:00Z", "2026-10-18 10:00:00+02:00"
    private static final DateTimeFormatter READ_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter();

    private final Path path;
    private final ZoneId zone;

    public CsvUsageObservationRepository(StoreConfig storeConfig, Clock clock) {
        this.path = Paths.get(storeConfig.getCsvPath());
        this.zone = clock.getZone();
    }

    @Override
    public List<Observation> findAll() {
        if (!Files.exists(path)) {
            log.info("No usage data at {}. Starting with an empty series.", path.toAbsolutePath());
            return List.of();
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .build();

        List<Observation> rows = new ArrayList<>();
        int skipped = 0;
        int rejected = 0;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            Map<String, Integer> header = parser.getHeaderMap();
            if (header == null || header.isEmpty()) {
                log.info("Usage table {} is empty. Starting with an empty series.", path.toAbsolutePath());
                return List.of();
            }
            if (!header.containsKey(COL_TIMESTAMP)) {
                throw new IllegalStateException("Usage table " + path + " has no '" + COL_TIMESTAMP + "' column");
            }
            for (CSVRecord record : parser) {
                Instant timestamp = parseTimestamp(record.get(COL_TIMESTAMP));
                if (timestamp == null) {
                    skipped++;
                    continue;
                }
                String raw = record.isMapped(COL_USAGE) && record.isSet(COL_USAGE) ? record.get(COL_USAGE) : "";
                double usage = parseUsage(raw);
                if (!Double.isNaN(usage) && (!Double.isFinite(usage) || usage < 0)) {
                    // Infinite or negative usage is a meter fault, filled like any other gap
                    rejected++;
                    log.debug("Usage '{}' at {} is not a valid reading, treated as missing", raw, timestamp);
                    usage = Double.NaN;
                }
                rows.add(new Observation(timestamp, usage));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read usage data from " + path, e);
        }

        if (skipped > 0) {
            log.warn("Skipped {} rows with unparseable timestamps in {}", skipped, path);
        }
        if (rejected > 0) {
            log.warn("Treated {} infinite or negative usage values in {} as missing", rejected, path);
        }
        log.info("Read {} usage rows from {}", rows.size(), path);
        return rows;
    }

    @Override
    public void saveAll(List<Observation> snapshot) {
        Path parent = path.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Write next to the target, then swap, so a crash never leaves a truncated table
            tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer,
                         CSVFormat.DEFAULT.builder().setHeader(COL_TIMESTAMP, COL_USAGE).build())) {
                for (Observation obs : snapshot) {
                    printer.printRecord(
                            LOCAL_TIMESTAMP.format(LocalDateTime.ofInstant(obs.getTimestamp(), zone)),
                            obs.isMissing() ? "" : Double.toString(obs.getUsage()));
                }
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discard(tmp, e);
            throw new UncheckedIOException("Failed to write usage data to " + path, e);
        }
        log.debug("Wrote {} usage rows to {}", snapshot.size(), path);
    }

    private Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = READ_TIMESTAMP.parseBest(raw.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}'", raw);
            return null;
        }
    }

    private static void discard(Path tmp, IOException failure) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static double parseUsage(String raw) {
        if (raw == null || raw.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
