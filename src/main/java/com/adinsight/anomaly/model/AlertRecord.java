package com.adinsight.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * A delivered alert, kept only for rate limiting and deduplication.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class AlertRecord {
    String campaignId;
    MetricName metric;
    AnomalySeverity severity;
    Instant timestamp;
}
