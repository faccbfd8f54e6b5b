package com.demointel.anomaly.service;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.AnalysisRun;
import com.demointel.anomaly.model.AnomalyReport;
import com.demointel.anomaly.model.RawRecord;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Orchestrates one scoring run: load, score, export.
 *
 * Each run is tracked as an {@link AnalysisRun} and written out whether it succeeds or not.
 * A run with no usable records after cleaning fails and writes no tables.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalysisRunService {

    private static final int SUMMARY_ALERTS = 20;

    private final RegistrationCsvLoader loader;
    private final AnomalyPipeline pipeline;
    private final OutputRouter outputRouter;
    private final AnomalyScorerProperties properties;

    public AnalysisRun runAnalysis() {
        AnalysisRun run = AnalysisRun.builder()
                .runId(UUID.randomUUID().toString())
                .dataDir(properties.getInput().getDataDir())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        try {
            List<RawRecord> raw = loader.load();
            run.setRecordsLoaded(raw.size());

            AnomalyReport report = pipeline.score(raw);
            if (report.isEmpty()) {
                throw new NoUsableRecordsException(raw.size());
            }

            outputRouter.write(report);

            run.setRecordsScored(report.getRecords().size());
            run.setSevereCount(report.severeCount());
            run.setEarlyWarningCount(report.earlyWarningCount());
            run.setStatus("SUCCESS");
            logSummary(report);

        } catch (Exception e) {
            log.error("Analysis run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            outputRouter.writeRun(run);
        }
        return run;
    }

    private void logSummary(AnomalyReport report) {
        log.info("================ DEMOGRAPHIC INTELLIGENCE SUMMARY ================");
        log.info("Total records analysed: {}", report.getRecords().size());
        log.info("Severe anomalies: {}", report.severeCount());
        log.info("Early-warning zones: {}", report.earlyWarningCount());

        report.getDistrictRanking().forEach(d ->
                log.info("District {}: {} severe, avg impact {}, dominant reason '{}'",
                        d.getDistrict(), d.getSevereCases(), String.format("%.3f", d.getAvgImpact()),
                        d.getDominantReason()));

        List<ScoredRecord> top = report.getPolicyAlerts().stream().limit(SUMMARY_ALERTS).toList();
        for (ScoredRecord r : top) {
            log.info("Alert {}/{}/{} impact={} confidence={} persistence={} peer_deviation={} reason='{}' action='{}'",
                    r.getState(), r.getDistrict(), r.getPincode(),
                    r.getImpactScore(), r.getConfidence(), r.getPersistence(), r.getPeerDeviation(),
                    r.getReason(), r.getRecommendedAction().label());
        }
        log.info("Output written to {}", properties.getOutput().getOutputDir());
    }
}
