package com.demointel.anomaly.model;

/**
 * Field action recommended for a record, strongest first.
 */
public enum RecommendedAction {
    IMMEDIATE_AUDIT("Immediate audit & field verification"),
    TARGETED_INVESTIGATION("Targeted demographic investigation"),
    MONITOR_CLOSELY("Monitor closely"),
    NO_ACTION("No action");

    private final String label;

    RecommendedAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
