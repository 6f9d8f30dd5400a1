package com.adinsight.anomaly.engine.rootcause;

import com.adinsight.anomaly.model.AnomalySeverity;
import com.adinsight.anomaly.model.CauseCategory;
import com.adinsight.anomaly.model.CauseConfidence;
import com.adinsight.anomaly.model.RootCauseAction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * One row of the cause rule table: a candidate cause and the anomalies it applies to.
 */
@Value
@Builder
public class CauseTemplate {

    public enum Direction {
        INCREASE,
        DECREASE
    }

    String id;
    CauseCategory category;
    String name;
    String description;
    CauseConfidence baseConfidence;

    // Null matches either direction
    Direction direction;

    @Singular
    Set<AnomalySeverity> severities;

    // Bounds on |changePercent|: min inclusive, max exclusive; null is unbounded
    Double minMagnitudePct;
    Double maxMagnitudePct;

    List<String> evidence;

    @Singular
    List<RootCauseAction> actions;

    public boolean appliesTo(boolean increase, AnomalySeverity severity, double absChangePercent) {
        if (direction != null && (direction == Direction.INCREASE) != increase) {
            return false;
        }
        if (!severities.isEmpty() && !severities.contains(severity)) {
            return false;
        }
        if (minMagnitudePct != null && absChangePercent < minMagnitudePct) {
            return false;
        }
        return maxMagnitudePct == null || absChangePercent < maxMagnitudePct;
    }
}
