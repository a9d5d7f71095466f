package com.callreplay.infrastructure.storage;

import com.callreplay.domain.analysis.model.AnalysisResponse;
import com.callreplay.domain.analysis.model.HistoryQuery;
import com.callreplay.domain.analysis.model.StoreStats;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only collection of analysis records kept as one JSON array on disk.
 * <p>
 * Every append reads the whole file, adds to it and rewrites it. There is no
 * lock: two writers that interleave read-old/write-stale lose one record,
 * and the last write wins.
 * </p>
 */
@Slf4j
@Component
public class AnalysisResultStore {

    static final String ANALYSIS_FILE_NAME = "analyzed_calls.json";
    static final int CALL_ID_PREVIEW = 10;

    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final TypeReference<List<AnalysisResponse>> RECORD_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Path dataDir;
    private final Path analysisFile;

    public AnalysisResultStore(ObjectMapper objectMapper,
                               Clock clock,
                               @Value("${storage.data-dir:data}") String dataDir) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.dataDir = Path.of(dataDir);
        this.analysisFile = this.dataDir.resolve(ANALYSIS_FILE_NAME);
    }

    /**
     * Adds one record. A backing file that exists but cannot be parsed is left
     * untouched and the append fails.
     */
    public boolean append(AnalysisResponse record) {
        try {
            AnalysisResponse stamped = record.timestamp() == null ? record.withTimestamp(now()) : record;
            List<AnalysisResponse> records = readRecords();
            records.add(stamped);
            writeAll(records);
            log.info("Saved analysis for call {}", record.callId());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Error saving analysis for call {}: {}", record.callId(), e.getMessage());
            return false;
        }
    }

    /**
     * Full scan in storage order: date range, call id and status filters, then
     * {@code limit}, then a newest-first sort of whatever survived. A limited
     * result is therefore not necessarily the newest N records.
     */
    public List<AnalysisResponse> query(HistoryQuery query) {
        List<AnalysisResponse> filtered = new ArrayList<>();
        for (AnalysisResponse record : loadAll()) {
            if (query.hasDateRange() && !withinRange(record, query.startDate(), query.endDate())) continue;
            if (query.callId() != null && !query.callId().equals(record.callId())) continue;
            if (query.status() != null && query.status() != record.status()) continue;
            filtered.add(record);
        }

        if (query.limit() != null && query.limit() > 0 && filtered.size() > query.limit()) {
            filtered = new ArrayList<>(filtered.subList(0, query.limit()));
        }

        filtered.sort(Comparator.comparing(
                (AnalysisResponse record) -> Timestamps.parse(record.timestamp()).orElse(Instant.MIN))
                .reversed());

        log.info("Retrieved {} analysis records with filters", filtered.size());
        return filtered;
    }

    public StoreStats stats() {
        List<AnalysisResponse> records = loadAll();
        if (records.isEmpty()) {
            return StoreStats.empty();
        }

        Map<String, Long> statusBreakdown = new LinkedHashMap<>();
        Set<String> callIds = new LinkedHashSet<>();
        Instant earliest = null;
        Instant latest = null;

        for (AnalysisResponse record : records) {
            String status = record.status() != null ? record.status().getValue() : "unknown";
            statusBreakdown.merge(status, 1L, Long::sum);

            if (record.callId() != null) {
                callIds.add(record.callId());
            }

            Optional<Instant> timestamp = Timestamps.parse(record.timestamp());
            if (timestamp.isPresent()) {
                Instant ts = timestamp.get();
                earliest = earliest == null || ts.isBefore(earliest) ? ts : earliest;
                latest = latest == null || ts.isAfter(latest) ? ts : latest;
            }
        }

        StoreStats.DateRange dateRange = earliest == null ? null : new StoreStats.DateRange(
                earliest.toString(), latest.toString(), Duration.between(earliest, latest).toDays());

        return new StoreStats(
                records.size(),
                dateRange,
                statusBreakdown,
                callIds.size(),
                callIds.stream().limit(CALL_ID_PREVIEW).toList());
    }

    public boolean clear() {
        try {
            if (Files.deleteIfExists(analysisFile)) {
                log.info("Cleared all analysis data");
            }
            return true;
        } catch (IOException e) {
            log.error("Error clearing analysis data: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Copies the backing file to {@code backupPath}, or to a timestamped file
     * next to it when no path is given.
     */
    public boolean backup(String backupPath) {
        if (!Files.exists(analysisFile)) {
            log.warn("No analysis data to backup");
            return false;
        }

        Path target = backupPath != null
                ? Path.of(backupPath)
                : dataDir.resolve("analyzed_calls_backup_"
                        + BACKUP_SUFFIX.format(clock.instant().atZone(clock.getZone())) + ".json");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(analysisFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("Backup created at: {}", target);
            return true;
        } catch (IOException e) {
            log.error("Error creating backup at {}: {}", target, e.getMessage());
            return false;
        }
    }

    /**
     * Reads every stored record for queries. An unreadable file is logged and treated as empty.
     */
    List<AnalysisResponse> loadAll() {
        try {
            return readRecords();
        } catch (IOException e) {
            log.error("Error loading analysis data: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private List<AnalysisResponse> readRecords() throws IOException {
        if (!Files.exists(analysisFile)) {
            log.debug("No analysis data found, starting with empty storage");
            return new ArrayList<>();
        }
        List<AnalysisResponse> records = objectMapper.readValue(analysisFile.toFile(), RECORD_LIST);
        log.debug("Loaded {} analysis records from storage", records.size());
        return new ArrayList<>(records);
    }

    void writeAll(List<AnalysisResponse> records) throws IOException {
        Files.createDirectories(dataDir);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(analysisFile.toFile(), records);
    }

    Path getAnalysisFile() {
        return analysisFile;
    }

    private String now() {
        return DateTimeFormatter.ISO_INSTANT.format(clock.instant());
    }

    private static boolean withinRange(AnalysisResponse record, Instant start, Instant end) {
        Optional<Instant> timestamp = Timestamps.parse(record.timestamp());
        if (timestamp.isEmpty()) {
            return false;
        }
        Instant ts = timestamp.get();
        return (start == null || !ts.isBefore(start)) && (end == null || !ts.isAfter(end));
    }
}
