package com.demointel.anomaly.service;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.RawRecord;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads demographic registration extracts into raw rows.
 *
 * Files matching {@code input.file-glob} in {@code input.data-dir} are read in file-name
 * order. Header names are trimmed and lower-cased; columns are looked up by name, so
 * extra columns and column order do not matter. A file missing a required column is
 * skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RegistrationCsvLoader {

    static final String COL_DATE = "date";
    static final String COL_STATE = "state";
    static final String COL_DISTRICT = "district";
    static final String COL_PINCODE = "pincode";
    static final String COL_AGE_5_17 = "demo_age_5_17";
    static final String COL_AGE_17_PLUS = "demo_age_17_";

    private static final List<String> REQUIRED = List.of(
            COL_DATE, COL_STATE, COL_DISTRICT, COL_PINCODE, COL_AGE_5_17, COL_AGE_17_PLUS);

    private final AnomalyScorerProperties properties;

    public List<RawRecord> load() {
        Path dataDir = Paths.get(properties.getInput().getDataDir());
        List<Path> files = discover(dataDir, properties.getInput().getFileGlob());
        if (files.isEmpty()) {
            log.warn("No files matching {} in {}", properties.getInput().getFileGlob(), dataDir.toAbsolutePath());
            return List.of();
        }

        List<RawRecord> records = new ArrayList<>();
        for (Path file : files) {
            records.addAll(read(file));
        }
        log.info("Loaded {} raw rows from {} files", records.size(), files.size());
        return records;
    }

    List<Path> discover(Path dataDir, String glob) {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> entries = Files.list(dataDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list data directory: " + dataDir, e);
        }
    }

    List<RawRecord> read(Path file) {
        String sourceFile = file.getFileName().toString();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader).build()) {

            String[] header = csv.readNext();
            if (header == null) {
                log.warn("Skipping empty file {}", sourceFile);
                return List.of();
            }

            Map<String, Integer> columns = indexColumns(header);
            List<String> missing = REQUIRED.stream().filter(c -> !columns.containsKey(c)).toList();
            if (!missing.isEmpty()) {
                log.warn("Skipping {}: missing columns {}", sourceFile, missing);
                return List.of();
            }

            List<RawRecord> records = new ArrayList<>();
            String[] row;
            while ((row = csv.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;
                records.add(RawRecord.builder()
                        .date(get(row, columns.get(COL_DATE)))
                        .state(get(row, columns.get(COL_STATE)))
                        .district(get(row, columns.get(COL_DISTRICT)))
                        .pincode(get(row, columns.get(COL_PINCODE)))
                        .demoAge5To17(get(row, columns.get(COL_AGE_5_17)))
                        .demoAge17Plus(get(row, columns.get(COL_AGE_17_PLUS)))
                        .sourceFile(sourceFile)
                        .build());
            }
            log.debug("Read {} rows from {}", records.size(), sourceFile);
            return records;

        } catch (IOException | CsvValidationException e) {
            log.warn("Skipping {}: unreadable CSV ({})", sourceFile, e.getMessage());
            return List.of();
        }
    }

    static Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
            columns.putIfAbsent(name, i);
        }
        return columns;
    }

    private static String get(String[] row, int idx) {
        return idx < row.length ? row[idx] : null;
    }
}
