package com.demointel.anomaly.risk;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.util.Stats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends confidence, persistence and impact_score.
 *
 *  - confidence   = ml_score / max(ml_score), three decimals; 0 when the max is 0
 *  - persistence  = share of SEVERE records per (district, pincode), joined back
 *  - impact_score = w_c * confidence + w_p * persistence + w_n * ln(1 + total_population)
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RiskComposer {

    private final AnomalyScorerProperties properties;

    public List<ScoredRecord> compose(List<ScoredRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }

        double maxScore = records.stream().mapToDouble(ScoredRecord::getMlScore).max().orElse(0d);
        Map<GeoKey, Double> persistence = persistenceByGeography(records);
        log.info("Persistence computed for {} (district, pincode) keys", persistence.size());

        AnomalyScorerProperties.Impact weights = properties.getImpact();
        List<ScoredRecord> result = new ArrayList<>(records.size());
        for (ScoredRecord r : records) {
            double confidence = Stats.round(Stats.safeDivide(r.getMlScore(), maxScore), 3);
            double geoPersistence = persistence.get(GeoKey.of(r));
            double impact = weights.getConfidenceWeight() * confidence
                    + weights.getPersistenceWeight() * geoPersistence
                    + weights.getPopulationWeight() * Math.log1p(r.getTotalPopulation());

            result.add(r.toBuilder()
                    .confidence(confidence)
                    .persistence(geoPersistence)
                    .impactScore(Stats.round(impact, 3))
                    .build());
        }
        return result;
    }

    /** Mean of the SEVERE indicator per (district, pincode), over the whole table. */
    public static Map<GeoKey, Double> persistenceByGeography(List<ScoredRecord> records) {
        Map<GeoKey, long[]> counts = new HashMap<>();
        for (ScoredRecord r : records) {
            long[] c = counts.computeIfAbsent(GeoKey.of(r), k -> new long[2]);
            c[0]++;
            if (r.isSevere()) c[1]++;
        }
        Map<GeoKey, Double> persistence = new HashMap<>(counts.size());
        counts.forEach((key, c) -> persistence.put(key, (double) c[1] / c[0]));
        return Map.copyOf(persistence);
    }

    /** Aggregation key for persistence. Either part may be null. */
    public record GeoKey(String district, String pincode) {

        static GeoKey of(ScoredRecord r) {
            return new GeoKey(r.getDistrict(), r.getPincode());
        }
    }
}
