package com.demointel.anomaly.output;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.AnomalyReport;
import com.demointel.anomaly.model.DistrictRisk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Plain-text summary of a run for auditors.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TextReportWriter {

    public static final String REPORT_FILE = "uidai_demographic_intelligence_report.txt";

    static final String TITLE = "UIDAI DEMOGRAPHIC INTELLIGENCE REPORT";
    static final String INTERPRETATION =
            "The demographic stress observed is driven primarily by abrupt population "
            + "changes and age-structure imbalance. Early-warning zones highlight regions "
            + "showing emerging instability before reaching severe anomaly thresholds.";

    private final AnomalyScorerProperties properties;

    public void write(AnomalyReport report) {
        Path outputDir = Paths.get(properties.getOutput().getOutputDir());
        Path path = outputDir.resolve(REPORT_FILE);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(path, render(report), StandardCharsets.UTF_8);
            log.info("Written text report: {}", path);
        } catch (IOException e) {
            log.error("Failed to write report {}: {}", path, e.getMessage(), e);
            throw new UncheckedIOException("Report write failed: " + path, e);
        }
    }

    static String render(AnomalyReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(TITLE).append('\n');
        sb.append("=".repeat(65)).append("\n\n");
        sb.append("Total records analysed: ").append(report.getRecords().size()).append('\n');
        sb.append("Severe anomalies detected: ").append(report.severeCount()).append('\n');
        sb.append("Early-warning zones detected: ").append(report.earlyWarningCount()).append("\n\n");

        sb.append("High-risk districts ranked by impact:\n");
        sb.append(String.format(Locale.ROOT, "%-30s %12s %10s  %s\n",
                "district", "severe_cases", "avg_impact", "dominant_reason"));
        for (DistrictRisk d : report.getDistrictRanking()) {
            sb.append(String.format(Locale.ROOT, "%-30s %12d %10.3f  %s\n",
                    d.getDistrict(), d.getSevereCases(), d.getAvgImpact(), d.getDominantReason()));
        }

        sb.append("\nInterpretation:\n");
        sb.append(INTERPRETATION).append('\n');
        return sb.toString();
    }
}
