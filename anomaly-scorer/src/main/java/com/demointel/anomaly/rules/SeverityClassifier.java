package com.demointel.anomaly.rules;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.MlFlag;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.model.Severity;
import com.demointel.anomaly.util.Stats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps model output to NORMAL / SUSPICIOUS / SEVERE.
 *
 * Rules, last match wins:
 *  - default NORMAL
 *  - outlier flag: SUSPICIOUS
 *  - ml_score strictly below the severity percentile of all scores: SEVERE,
 *    whatever the flag
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SeverityClassifier {

    private final AnomalyScorerProperties properties;

    public List<ScoredRecord> classify(List<ScoredRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }

        double percentile = properties.getSeverity().getPercentile();
        if (!(percentile > 0d && percentile < 1d)) {
            throw new IllegalArgumentException("severity percentile must be in (0, 1): " + percentile);
        }

        double[] scores = records.stream().mapToDouble(ScoredRecord::getMlScore).toArray();
        double cutoff = Stats.quantile(scores, percentile);
        List<SeverityRule> rules = rules(cutoff);

        List<ScoredRecord> result = new ArrayList<>(records.size());
        for (ScoredRecord r : records) {
            result.add(r.toBuilder().severity(severityOf(r, rules)).build());
        }
        log.debug("Severity cutoff at ml_score {}", cutoff);
        return result;
    }

    public static List<SeverityRule> rules(double severeCutoff) {
        return List.of(
                new SeverityRule("outlier-flag", Severity.SUSPICIOUS,
                        r -> r.getMlFlag() == MlFlag.OUTLIER),
                new SeverityRule("below-severity-percentile", Severity.SEVERE,
                        r -> r.getMlScore() < severeCutoff)
        );
    }

    public static Severity severityOf(ScoredRecord record, List<SeverityRule> rules) {
        Severity severity = Severity.NORMAL;
        for (SeverityRule rule : rules) {
            if (rule.matches(record)) {
                severity = rule.severity();
            }
        }
        return severity;
    }
}
