package com.adinsight.anomaly.model;

public enum CauseCategory {
    EXTERNAL,
    INTERNAL,
    TECHNICAL,
    MARKET
}
