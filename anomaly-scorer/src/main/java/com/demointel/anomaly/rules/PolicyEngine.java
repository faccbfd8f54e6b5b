package com.demointel.anomaly.rules;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.RecommendedAction;
import com.demointel.anomaly.model.ScoredRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps impact score to a recommended action. Tiers are checked from the highest
 * threshold down; the first tier the score is strictly above wins.
 */
@Component
public class PolicyEngine {

    private final List<PolicyTier> tiers;

    public PolicyEngine(AnomalyScorerProperties properties) {
        AnomalyScorerProperties.Policy config = properties.getPolicy();
        this.tiers = List.of(
                new PolicyTier(RecommendedAction.IMMEDIATE_AUDIT, config.getImmediateAudit()),
                new PolicyTier(RecommendedAction.TARGETED_INVESTIGATION, config.getTargetedInvestigation()),
                new PolicyTier(RecommendedAction.MONITOR_CLOSELY, config.getMonitor())
        );
    }

    public List<ScoredRecord> recommend(List<ScoredRecord> records) {
        List<ScoredRecord> result = new ArrayList<>(records.size());
        for (ScoredRecord r : records) {
            result.add(r.toBuilder().recommendedAction(actionFor(r.getImpactScore())).build());
        }
        return result;
    }

    public RecommendedAction actionFor(double impactScore) {
        for (PolicyTier tier : tiers) {
            if (tier.appliesTo(impactScore)) {
                return tier.action();
            }
        }
        return RecommendedAction.NO_ACTION;
    }
}
