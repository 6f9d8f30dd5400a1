package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

/**
 * Anomalies grouped by campaign, with cross-cutting insights, metric co-movement and the
 * propagation chain inside the most affected campaign.
 */
@Value
@Builder
public class SegmentAnalysis {

    // Most severe campaign first
    List<SegmentDetail> segments;
    List<Insight> insights;

    // Strongest first
    List<MetricCorrelation> correlations;

    // Null when no campaign has a follow-on anomaly
    Propagation propagation;

    public static SegmentAnalysis empty() {
        return SegmentAnalysis.builder()
                .segments(List.of())
                .insights(List.of())
                .correlations(List.of())
                .build();
    }

    @Value
    @Builder
    public static class SegmentDetail {
        String name;
        int anomalyCount;
        List<Anomaly> anomalies;
        // Mean of CRITICAL=3, WARNING=2, INFO=1
        double avgSeverityScore;
        AnomalyType dominantType;
        MetricName mostAffectedMetric;
        TimeDistribution timeDistribution;
    }

    @Value
    @Builder
    public static class TimeDistribution {
        long weekday;
        long weekend;
        Map<DayOfWeek, Long> byDayOfWeek;
    }

    public enum InsightType {
        PATTERN,
        CORRELATION,
        RECOMMENDATION,
        WARNING
    }

    @Value
    @Builder
    public static class Insight {
        String id;
        InsightType type;
        String title;
        String description;
        double confidence;
        List<String> relatedSegments;
        List<String> actionItems;
    }

    public enum CorrelationType {
        POSITIVE,
        NEGATIVE
    }

    @Value
    @Builder
    public static class MetricCorrelation {
        MetricName metric1;
        MetricName metric2;
        CorrelationType type;
        // Share of co-occurrences moving in that direction, 0..1
        double strength;
        String description;
    }

    @Value
    @Builder
    public static class Propagation {
        Anomaly rootAnomaly;
        List<Anomaly> propagatedAnomalies;
        List<MetricName> chain;
        double impactScore;
    }
}
