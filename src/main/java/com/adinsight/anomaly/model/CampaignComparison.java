package com.adinsight.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CampaignComparison {

    String campaignId;
    String campaignName;
    int anomalyCount;
    double avgSeverity;
    AnomalyType dominantAnomalyType;
    Map<MetricName, MetricSummary> metrics;

    // 0..100, higher is healthier
    int healthScore;

    @Value
    @AllArgsConstructor(staticName = "of")
    public static class MetricSummary {
        int anomalyCount;
        // Mean absolute change percent
        double avgChange;
    }
}
