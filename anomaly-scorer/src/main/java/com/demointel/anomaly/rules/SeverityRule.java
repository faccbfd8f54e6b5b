package com.demointel.anomaly.rules;

import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.model.Severity;

import java.util.function.Predicate;

/**
 * Assigns {@code severity} to records matching {@code condition}.
 * Rules are applied in list order and a later match overrides an earlier one.
 */
public record SeverityRule(String name, Severity severity, Predicate<ScoredRecord> condition) {

    public boolean matches(ScoredRecord record) {
        return condition.test(record);
    }
}
