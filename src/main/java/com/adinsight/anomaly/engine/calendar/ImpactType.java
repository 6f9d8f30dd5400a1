package com.adinsight.anomaly.engine.calendar;

public enum ImpactType {
    POSITIVE,
    NEGATIVE,
    MIXED
}
