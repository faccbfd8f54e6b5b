package com.demointel.anomaly.model;

public enum Severity {
    NORMAL, SUSPICIOUS, SEVERE
}
