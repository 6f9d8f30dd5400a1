package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A statistically significant deviation of one campaign metric. Immutable once emitted.
 *
 * <p>{@code previousValue} is the prior observation. {@code referenceValue} is what the
 * change was measured against: the prior observation on the day-over-day path, the
 * baseline mean or moving average on the statistical paths.
 */
@Value
@Builder(toBuilder = true)
public class Anomaly {

    String id;
    String campaignId;
    String campaignName;
    AnomalyType type;
    AnomalySeverity severity;
    MetricName metric;
    double currentValue;
    double previousValue;
    double referenceValue;
    double changePercent;
    String message;
    Instant detectedAt;
    DetectionMethod detectionMethod;

    // Statistical detail, present depending on the method that fired
    Double zScore;
    Double iqrDistance;
    TrendDirection historicalTrend;
    Baseline baseline;
    MarketContext marketContext;

    List<String> recommendations;

    public boolean isIncrease() {
        return changePercent >= 0 && type != AnomalyType.DROP;
    }

    public boolean isAdverse() {
        return metric.isAdverse(isIncrease());
    }
}
