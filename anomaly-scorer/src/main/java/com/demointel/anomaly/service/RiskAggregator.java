package com.demointel.anomaly.service;

import com.demointel.anomaly.model.DistrictRisk;
import com.demointel.anomaly.model.ScoredRecord;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only views over the scored table used for ranking and export.
 */
@Component
public class RiskAggregator {

    /**
     * Districts with at least one SEVERE record, by mean impact descending,
     * then district name ascending.
     */
    public List<DistrictRisk> districtRanking(List<ScoredRecord> records) {
        Map<String, List<ScoredRecord>> severeByDistrict = records.stream()
                .filter(ScoredRecord::isSevere)
                .collect(Collectors.groupingBy(r -> r.getDistrict() == null ? "" : r.getDistrict(),
                        LinkedHashMap::new, Collectors.toList()));

        return severeByDistrict.entrySet().stream()
                .map(e -> DistrictRisk.builder()
                        .district(e.getKey())
                        .severeCases(e.getValue().size())
                        .avgImpact(e.getValue().stream().mapToDouble(ScoredRecord::getImpactScore).average().orElse(0d))
                        .dominantReason(dominantReason(e.getValue()))
                        .build())
                .sorted(Comparator.comparingDouble(DistrictRisk::getAvgImpact).reversed()
                        .thenComparing(DistrictRisk::getDistrict))
                .toList();
    }

    /** SEVERE records by impact descending; equal impacts keep table order. */
    public List<ScoredRecord> policyAlerts(List<ScoredRecord> records) {
        return records.stream()
                .filter(ScoredRecord::isSevere)
                .sorted(Comparator.comparingDouble(ScoredRecord::getImpactScore).reversed())
                .toList();
    }

    public List<ScoredRecord> earlyWarningZones(List<ScoredRecord> records) {
        return records.stream()
                .filter(r -> Boolean.TRUE.equals(r.getEarlyWarning()))
                .toList();
    }

    /** Most frequent reason; ties go to the lexicographically smallest. */
    static String dominantReason(List<ScoredRecord> records) {
        Map<String, Long> counts = records.stream()
                .collect(Collectors.groupingBy(ScoredRecord::getReason, TreeMap::new, Collectors.counting()));
        String best = null;
        long bestCount = 0;
        for (Map.Entry<String, Long> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }
}
