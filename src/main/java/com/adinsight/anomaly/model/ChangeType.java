package com.adinsight.anomaly.model;

public enum ChangeType {
    BUDGET,
    TARGETING,
    CREATIVE,
    BID,
    SCHEDULE
}
