package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one user's evaluation run: anomalies with their analyses, summary counts,
 * the market events in effect, the campaign segmentation and what was dispatched.
 */
@Value
@Builder
public class EvaluationReport {

    String userId;
    Instant evaluatedAt;
    List<AnalyzedAnomaly> anomalies;
    Map<AnomalySeverity, Long> countsBySeverity;
    Map<AnomalyType, Long> countsByType;
    List<String> marketEvents;
    SegmentAnalysis segments;
    AlertDispatchResult dispatch;

    // False when the deadline cut detection or dispatch short
    boolean complete;

    public int total() {
        return anomalies.size();
    }
}
