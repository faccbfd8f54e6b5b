package com.demointel.anomaly.output;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.AnalysisRun;
import com.demointel.anomaly.model.AnomalyReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports CSV, REPORT, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final CsvReportWriter csvReportWriter;
    private final TextReportWriter textReportWriter;
    private final RunManifestWriter runManifestWriter;
    private final AnomalyScorerProperties properties;

    public void write(AnomalyReport report) {
        AnomalyScorerProperties.Output.OutputMode mode = properties.getOutput().getMode();

        switch (mode) {
            case CSV -> csvReportWriter.write(report);
            case REPORT -> textReportWriter.write(report);
            case BOTH -> {
                csvReportWriter.write(report);
                textReportWriter.write(report);
            }
        }
    }

    public void writeRun(AnalysisRun run) {
        try {
            runManifestWriter.write(run);
        } catch (Exception e) {
            log.warn("Failed to write run metadata: {}", e.getMessage());
        }
    }
}
