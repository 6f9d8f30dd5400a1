package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RootCauseAction {

    String id;
    ActionPriority priority;
    String title;
    String description;
    String estimatedImpact;
    ActionTimeframe timeframe;

    /** Human-readable next-step line, e.g. {@code [CRITICAL] Verify pixel: ... (immediately)}. */
    public String toNextStep() {
        return String.format("[%s] %s: %s (%s)", priority, title, description, timeframe.getLabel());
    }
}
