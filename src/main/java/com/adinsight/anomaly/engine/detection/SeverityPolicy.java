package com.adinsight.anomaly.engine.detection;

import com.adinsight.anomaly.config.DetectionConfig;
import com.adinsight.anomaly.model.AnomalySeverity;
import com.adinsight.anomaly.model.AnomalyType;
import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.model.TrendDirection;
import org.springframework.stereotype.Component;

/**
 * Severity and type assignment for detected candidates.
 *
 * <p>Base severity comes from the per-metric rule for the move's direction. Adverse moves
 * with a statistical magnitude above the escalation limit go up one level; favourable moves
 * keep their base severity. Large spend swings in either direction are at least WARNING.</p>
 */
@Component
public class SeverityPolicy {

    private final DetectionConfig config;

    public SeverityPolicy(DetectionConfig config) {
        this.config = config;
    }

    public AnomalySeverity severityFor(MetricName metric, boolean increase, double magnitude, double changePercent) {
        AnomalySeverity severity = baseSeverity(metric, increase);

        if (metric.isAdverse(increase) && magnitude > config.getEscalationMagnitude()) {
            severity = severity.escalate();
        }

        if (metric == MetricName.SPEND
                && Math.abs(changePercent) >= config.getBudgetSwingMultiplier() * config.getSpikeThresholdPct()
                && !severity.isAtLeast(AnomalySeverity.WARNING)) {
            severity = AnomalySeverity.WARNING;
        }
        return severity;
    }

    public AnomalyType typeFor(MetricName metric, boolean increase, TrendDirection trend) {
        if (metric == MetricName.SPEND && increase) {
            return AnomalyType.BUDGET_ANOMALY;
        }
        if ((trend == TrendDirection.INCREASING && !increase)
                || (trend == TrendDirection.DECREASING && increase)) {
            return AnomalyType.TREND_CHANGE;
        }
        return increase ? AnomalyType.SPIKE : AnomalyType.DROP;
    }

    private AnomalySeverity baseSeverity(MetricName metric, boolean increase) {
        DetectionConfig.SeverityRule override = config.getSeverity().get(metric);
        if (override != null) {
            AnomalySeverity configured = increase ? override.getSpike() : override.getDrop();
            if (configured != null) {
                return configured;
            }
        }
        return increase ? metric.getSpikeSeverity() : metric.getDropSeverity();
    }
}
