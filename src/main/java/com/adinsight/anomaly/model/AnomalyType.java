package com.adinsight.anomaly.model;

public enum AnomalyType {
    SPIKE,
    DROP,
    TREND_CHANGE,
    BUDGET_ANOMALY
}
