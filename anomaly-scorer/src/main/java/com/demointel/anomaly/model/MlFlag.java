package com.demointel.anomaly.model;

/**
 * Binary output of the outlier model.
 */
public enum MlFlag {
    INLIER("inlier"),
    OUTLIER("outlier");

    private final String label;

    MlFlag(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
