package com.adinsight.anomaly.model;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE,
    VOLATILE
}
