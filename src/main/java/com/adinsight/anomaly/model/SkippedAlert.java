package com.adinsight.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class SkippedAlert {
    Anomaly anomaly;
    SkipReason reason;
    String detail;
}
