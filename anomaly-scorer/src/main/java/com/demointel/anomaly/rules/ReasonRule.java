package com.demointel.anomaly.rules;

import com.demointel.anomaly.model.ScoredRecord;

import java.util.function.Predicate;

/**
 * Human-readable reason attached to a record when {@code condition} holds.
 */
public record ReasonRule(String reason, Predicate<ScoredRecord> condition) {

    public boolean matches(ScoredRecord record) {
        return condition.test(record);
    }
}
