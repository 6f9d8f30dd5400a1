package com.adinsight.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class AnalyzedAnomaly {
    Anomaly anomaly;
    RootCauseAnalysis analysis;
}
