package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class RootCauseAnalysis {

    String anomalyId;
    MetricName metric;
    Instant analyzedAt;

    // At most three, ranked
    List<PossibleCause> topCauses;
    List<PossibleCause> allCauses;

    UrgencyLevel urgencyLevel;
    String summary;

    // At most five
    List<String> nextSteps;
}
