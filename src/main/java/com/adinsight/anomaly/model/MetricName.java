package com.adinsight.anomaly.model;

/**
 * Campaign KPIs the detector understands.
 *
 * Each metric knows whether an increase or a decrease hurts the advertiser,
 * which calendar range applies to it, and its default severity per direction.
 */
public enum MetricName {

    SPEND("Spend", MetricKind.COST, ExpectedChangeKey.SPEND, AnomalySeverity.WARNING, AnomalySeverity.INFO),
    IMPRESSIONS("Impressions", MetricKind.VALUE, ExpectedChangeKey.SPEND, AnomalySeverity.INFO, AnomalySeverity.WARNING),
    CLICKS("Clicks", MetricKind.VALUE, ExpectedChangeKey.SPEND, AnomalySeverity.INFO, AnomalySeverity.WARNING),
    CONVERSIONS("Conversions", MetricKind.VALUE, ExpectedChangeKey.CONVERSION, AnomalySeverity.INFO, AnomalySeverity.CRITICAL),
    CTR("CTR", MetricKind.VALUE, ExpectedChangeKey.CTR, AnomalySeverity.INFO, AnomalySeverity.WARNING),
    CPA("CPA", MetricKind.COST, ExpectedChangeKey.CONVERSION, AnomalySeverity.CRITICAL, AnomalySeverity.INFO),
    ROAS("ROAS", MetricKind.VALUE, ExpectedChangeKey.CONVERSION, AnomalySeverity.INFO, AnomalySeverity.CRITICAL),
    CPC("CPC", MetricKind.COST, ExpectedChangeKey.SPEND, AnomalySeverity.WARNING, AnomalySeverity.INFO),
    CVR("CVR", MetricKind.VALUE, ExpectedChangeKey.CONVERSION, AnomalySeverity.INFO, AnomalySeverity.WARNING);

    private final String label;
    private final MetricKind kind;
    private final ExpectedChangeKey changeKey;
    private final AnomalySeverity spikeSeverity;
    private final AnomalySeverity dropSeverity;

    MetricName(String label, MetricKind kind, ExpectedChangeKey changeKey,
               AnomalySeverity spikeSeverity, AnomalySeverity dropSeverity) {
        this.label = label;
        this.kind = kind;
        this.changeKey = changeKey;
        this.spikeSeverity = spikeSeverity;
        this.dropSeverity = dropSeverity;
    }

    public String getLabel() {
        return label;
    }

    public MetricKind getKind() {
        return kind;
    }

    public ExpectedChangeKey getChangeKey() {
        return changeKey;
    }

    public AnomalySeverity getSpikeSeverity() {
        return spikeSeverity;
    }

    public AnomalySeverity getDropSeverity() {
        return dropSeverity;
    }

    /**
     * True when a move in the given direction is bad for the advertiser:
     * increases on cost metrics, decreases on everything else.
     */
    public boolean isAdverse(boolean increase) {
        return switch (kind) {
            case COST -> increase;
            case VALUE -> !increase;
        };
    }

    public enum MetricKind {
        COST,
        VALUE
    }
}
