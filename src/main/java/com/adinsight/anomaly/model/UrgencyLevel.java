package com.adinsight.anomaly.model;

public enum UrgencyLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
