package com.demointel.anomaly.rules;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.ScoredRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Explains records from their feature values alone, independent of the model.
 * Matching reasons are joined with "; " in rule order.
 */
@Component
@Slf4j
public class ExplainabilityEngine {

    public static final String YOUTH_HEAVY = "Youth-heavy population";
    public static final String AGEING = "Ageing population";
    public static final String SUDDEN_SHOCK = "Sudden demographic shock";
    public static final String LARGE_SWING = "Large population swing";
    public static final String FALLBACK = "Multi-factor deviation";

    private final List<ReasonRule> rules;

    public ExplainabilityEngine(AnomalyScorerProperties properties) {
        AnomalyScorerProperties.Explain config = properties.getExplain();
        this.rules = List.of(
                new ReasonRule(YOUTH_HEAVY, r -> r.getYouthRatio() > config.getYouthHeavyRatio()),
                new ReasonRule(AGEING, r -> r.getYouthRatio() < config.getAgeingRatio()),
                new ReasonRule(SUDDEN_SHOCK, r -> Math.abs(r.getShockScore()) > config.getShockThreshold()),
                new ReasonRule(LARGE_SWING,
                        r -> Math.abs(r.getPopChange()) > config.getSwingFraction() * r.getTotalPopulation())
        );
    }

    public List<ScoredRecord> explain(List<ScoredRecord> records) {
        List<ScoredRecord> result = new ArrayList<>(records.size());
        for (ScoredRecord r : records) {
            result.add(r.toBuilder().reason(reasonFor(r)).build());
        }
        return result;
    }

    public String reasonFor(ScoredRecord record) {
        String joined = rules.stream()
                .filter(rule -> rule.matches(record))
                .map(ReasonRule::reason)
                .collect(Collectors.joining("; "));
        return joined.isEmpty() ? FALLBACK : joined;
    }
}
