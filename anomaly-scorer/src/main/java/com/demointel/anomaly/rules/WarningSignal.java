package com.demointel.anomaly.rules;

import com.demointel.anomaly.model.ScoredRecord;

import java.util.function.Predicate;

/**
 * One vote towards an early warning.
 */
public record WarningSignal(String name, Predicate<ScoredRecord> condition) {

    public boolean votes(ScoredRecord record) {
        return condition.test(record);
    }
}
