package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Anomalies found for one user's campaigns, most urgent first.
 */
@Value
@Builder
public class DetectionResult {

    List<Anomaly> anomalies;
    int campaignsEvaluated;
    int campaignsFailed;

    // False when the deadline expired before every campaign finished
    boolean complete;
}
