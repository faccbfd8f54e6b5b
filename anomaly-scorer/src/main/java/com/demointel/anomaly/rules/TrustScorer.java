package com.demointel.anomaly.rules;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.util.Stats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * data_trust_score = clip(1 - (w_p * persistence + w_s * [SEVERE]), 0, 1), two decimals.
 */
@Component
@RequiredArgsConstructor
public class TrustScorer {

    private final AnomalyScorerProperties properties;

    public List<ScoredRecord> score(List<ScoredRecord> records) {
        List<ScoredRecord> result = new ArrayList<>(records.size());
        for (ScoredRecord r : records) {
            result.add(r.toBuilder().dataTrustScore(trustOf(r)).build());
        }
        return result;
    }

    public double trustOf(ScoredRecord record) {
        AnomalyScorerProperties.Trust config = properties.getTrust();
        double penalty = config.getPersistenceWeight() * record.getPersistence()
                + config.getSevereWeight() * (record.isSevere() ? 1d : 0d);
        return Stats.round(Stats.clip(1d - penalty, 0d, 1d), 2);
    }
}
