package com.adinsight.anomaly.engine.calendar;

public enum EventCategory {
    PUBLIC_HOLIDAY,
    COMMERCIAL,
    SEASONAL,
    INDUSTRY_SPECIFIC
}
