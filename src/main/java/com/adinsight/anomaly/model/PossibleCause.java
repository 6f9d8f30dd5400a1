package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;

@Value
@Builder
public class PossibleCause {

    String id;
    CauseCategory category;
    String name;
    String description;

    // Capped at 0.95
    double probability;

    CauseConfidence confidence;
    List<String> evidence;
    List<RootCauseAction> actions;

    /** Most urgent priority among this cause's actions, LOW when it has none. */
    public ActionPriority mostUrgentAction() {
        return actions.stream()
                .map(RootCauseAction::getPriority)
                .min(Comparator.naturalOrder())
                .orElse(ActionPriority.LOW);
    }

    public boolean hasActionWithPriority(ActionPriority priority) {
        return actions.stream().anyMatch(a -> a.getPriority() == priority);
    }
}
