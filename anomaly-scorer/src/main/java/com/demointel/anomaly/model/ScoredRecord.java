package com.demointel.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One (geography, date) observation together with every column the pipeline derives for it.
 *
 * Instances are immutable. Each stage appends its own columns through {@code toBuilder()};
 * a column that a later stage has not reached yet is {@code null}.
 */
@Value
@Builder(toBuilder = true)
public class ScoredRecord {

    // ── Source ──────────────────────────────────────────────────────────────
    LocalDate date;
    String state;
    String district;
    String pincode;

    /** Null when the source value was missing or non-numeric. */
    Double demoAge5To17;

    /** Null when the source value was missing or non-numeric. */
    Double demoAge17Plus;

    // ── Features ────────────────────────────────────────────────────────────
    double totalPopulation;
    double youthRatio;

    /** Change in total population against the previous record of the same pincode. */
    Double popChange;

    /** Global z-score of popChange. */
    Double shockScore;

    // ── Model ───────────────────────────────────────────────────────────────
    MlFlag mlFlag;

    /** Decision score; lower is more anomalous. */
    Double mlScore;

    Severity severity;
    String reason;

    // ── Risk ────────────────────────────────────────────────────────────────
    Double confidence;
    Double persistence;
    Double impactScore;
    RecommendedAction recommendedAction;

    // ── Peer comparison ─────────────────────────────────────────────────────
    Double stateAvgYouthRatio;
    Double peerDeviation;

    // ── Alerts ──────────────────────────────────────────────────────────────
    Boolean earlyWarning;
    Double dataTrustScore;

    public boolean isSevere() {
        return severity == Severity.SEVERE;
    }
}
