package com.demointel.anomaly.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each scoring run for observability.
 * Written next to the output tables as analysis_run.json.
 */
@Data
@Builder
public class AnalysisRun {

    private String runId;           // UUID
    private String dataDir;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int recordsLoaded;
    private int recordsScored;
    private long severeCount;
    private int earlyWarningCount;
    private String errorMessage;    // null on success
}
