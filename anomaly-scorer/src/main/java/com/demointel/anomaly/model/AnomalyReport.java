package com.demointel.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Complete output of one scoring pass: the scored table plus its three read-only views.
 */
@Value
@Builder
public class AnomalyReport {

    /** Every scored record, in table (date) order. */
    List<ScoredRecord> records;

    /** Districts with at least one SEVERE record, highest mean impact first. */
    List<DistrictRisk> districtRanking;

    /** SEVERE records, highest impact first. */
    List<ScoredRecord> policyAlerts;

    /** Records carrying an early warning, in table order. */
    List<ScoredRecord> earlyWarningZones;

    public static AnomalyReport empty() {
        return AnomalyReport.builder()
                .records(List.of())
                .districtRanking(List.of())
                .policyAlerts(List.of())
                .earlyWarningZones(List.of())
                .build();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public long severeCount() {
        return records.stream().filter(ScoredRecord::isSevere).count();
    }

    public int earlyWarningCount() {
        return earlyWarningZones.size();
    }
}
