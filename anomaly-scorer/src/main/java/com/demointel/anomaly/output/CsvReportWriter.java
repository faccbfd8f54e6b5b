package com.demointel.anomaly.output;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.AnomalyReport;
import com.demointel.anomaly.model.DistrictRisk;
import com.demointel.anomaly.model.ScoredRecord;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Function;

/**
 * Writes the scored table and its views as CSV files in {@code output.output-dir}:
 *
 *   full_ml_scored_data.csv      every record, every column
 *   district_risk_ranking.csv    one row per district with SEVERE records
 *   top_policy_alerts.csv        SEVERE records by impact
 *   early_warning_zones.csv      early-warning records
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvReportWriter {

    public static final String SCORED_FILE = "full_ml_scored_data.csv";
    public static final String DISTRICT_FILE = "district_risk_ranking.csv";
    public static final String ALERTS_FILE = "top_policy_alerts.csv";
    public static final String EARLY_WARNING_FILE = "early_warning_zones.csv";

    static final String[] RECORD_HEADERS = {
            "date", "state", "district", "pincode",
            "demo_age_5_17", "demo_age_17_",
            "total_population", "youth_ratio", "pop_change", "shock_score",
            "ml_flag", "ml_score", "severity", "reason",
            "confidence", "is_severe", "persistence", "impact_score", "recommended_action",
            "state_avg_youth_ratio", "peer_deviation",
            "early_warning", "data_trust_score"
    };

    static final String[] DISTRICT_HEADERS = {
            "district", "severe_cases", "avg_impact", "dominant_reason"
    };

    private final AnomalyScorerProperties properties;

    public void write(AnomalyReport report) {
        Path outputDir = Paths.get(properties.getOutput().getOutputDir());
        ensureDirectory(outputDir);

        writeFile(outputDir.resolve(SCORED_FILE), RECORD_HEADERS, report.getRecords(), CsvReportWriter::toRow);
        writeFile(outputDir.resolve(DISTRICT_FILE), DISTRICT_HEADERS, report.getDistrictRanking(), CsvReportWriter::toDistrictRow);
        writeFile(outputDir.resolve(ALERTS_FILE), RECORD_HEADERS, report.getPolicyAlerts(), CsvReportWriter::toRow);
        writeFile(outputDir.resolve(EARLY_WARNING_FILE), RECORD_HEADERS, report.getEarlyWarningZones(), CsvReportWriter::toRow);
    }

    private <T> void writeFile(Path path, String[] headers, List<T> rows, Function<T, String[]> mapper) {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }
            for (T row : rows) {
                writer.writeNext(mapper.apply(row));
            }

            log.info("Written {} rows to CSV: {}", rows.size(), path);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", path, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + path, e);
        }
    }

    static String[] toRow(ScoredRecord r) {
        return new String[]{
                str(r.getDate()),
                str(r.getState()),
                str(r.getDistrict()),
                str(r.getPincode()),
                str(r.getDemoAge5To17()),
                str(r.getDemoAge17Plus()),
                str(r.getTotalPopulation()),
                str(r.getYouthRatio()),
                str(r.getPopChange()),
                str(r.getShockScore()),
                r.getMlFlag() == null ? "" : r.getMlFlag().label(),
                str(r.getMlScore()),
                str(r.getSeverity()),
                str(r.getReason()),
                str(r.getConfidence()),
                str(r.isSevere()),
                str(r.getPersistence()),
                str(r.getImpactScore()),
                r.getRecommendedAction() == null ? "" : r.getRecommendedAction().label(),
                str(r.getStateAvgYouthRatio()),
                str(r.getPeerDeviation()),
                str(r.getEarlyWarning()),
                str(r.getDataTrustScore())
        };
    }

    static String[] toDistrictRow(DistrictRisk d) {
        return new String[]{
                str(d.getDistrict()),
                str(d.getSevereCases()),
                str(d.getAvgImpact()),
                str(d.getDominantReason())
        };
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
