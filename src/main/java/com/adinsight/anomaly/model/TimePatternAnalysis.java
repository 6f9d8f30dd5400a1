package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TimePatternAnalysis {

    public enum TimePattern {
        CONSISTENT,
        WEEKEND_SPIKE,
        WEEKDAY_SPIKE,
        PERIODIC,
        RANDOM
    }

    TimePattern pattern;
    double confidence;
    String details;
    List<String> recommendedMonitoring;
}
