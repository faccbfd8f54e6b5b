package com.demointel.anomaly.runner;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.AnalysisRun;
import com.demointel.anomaly.service.AnalysisRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one analysis when the application starts.
 *
 * Disable with RUN_ON_STARTUP=false or anomaly-scorer.run.run-on-startup=false.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalysisRunner implements ApplicationRunner {

    private final AnalysisRunService runService;
    private final AnomalyScorerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getRun().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=false, scorer idle");
            return;
        }

        log.info("Starting analysis of {}", properties.getInput().getDataDir());
        AnalysisRun run = runService.runAnalysis();
        log.info("Analysis run {} finished with status {}", run.getRunId(), run.getStatus());
    }
}
