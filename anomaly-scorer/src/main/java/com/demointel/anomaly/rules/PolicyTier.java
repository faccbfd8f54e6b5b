package com.demointel.anomaly.rules;

import com.demointel.anomaly.model.RecommendedAction;

/**
 * An action that applies when the impact score is strictly above {@code threshold}.
 */
public record PolicyTier(RecommendedAction action, double threshold) {

    public boolean appliesTo(double impactScore) {
        return impactScore > threshold;
    }
}
