package com.demointel.anomaly.risk;

import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.util.Stats;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares each record's youth ratio with the mean youth ratio of its state.
 * peer_deviation is signed and rounded to three decimals.
 */
@Component
public class PeerComparator {

    private static final String UNKNOWN_STATE = "";

    public List<ScoredRecord> compare(List<ScoredRecord> records) {
        Map<String, Double> baseline = stateBaseline(records);

        List<ScoredRecord> result = new ArrayList<>(records.size());
        for (ScoredRecord r : records) {
            double stateAvg = baseline.get(stateKey(r));
            result.add(r.toBuilder()
                    .stateAvgYouthRatio(stateAvg)
                    .peerDeviation(Stats.round(r.getYouthRatio() - stateAvg, 3))
                    .build());
        }
        return result;
    }

    public static Map<String, Double> stateBaseline(List<ScoredRecord> records) {
        Map<String, double[]> sums = new HashMap<>();
        for (ScoredRecord r : records) {
            double[] s = sums.computeIfAbsent(stateKey(r), k -> new double[2]);
            s[0] += r.getYouthRatio();
            s[1]++;
        }
        Map<String, Double> baseline = new HashMap<>(sums.size());
        sums.forEach((state, s) -> baseline.put(state, s[0] / s[1]));
        return Map.copyOf(baseline);
    }

    private static String stateKey(ScoredRecord r) {
        return r.getState() == null ? UNKNOWN_STATE : r.getState();
    }
}
