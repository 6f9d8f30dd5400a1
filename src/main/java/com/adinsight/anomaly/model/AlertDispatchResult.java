package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AlertDispatchResult {

    List<Anomaly> sent;
    List<SkippedAlert> skipped;

    // One line per failed delivery, naming the anomaly
    List<String> errors;

    public static AlertDispatchResult empty() {
        return AlertDispatchResult.builder()
                .sent(List.of())
                .skipped(List.of())
                .errors(List.of())
                .build();
    }

    public long countSkipped(SkipReason reason) {
        return skipped.stream().filter(s -> s.getReason() == reason).count();
    }
}
