package com.adinsight.anomaly.model;

/**
 * Coarse grouping of metrics used when segmenting anomalies.
 */
public enum MetricCategory {
    SPEND_RELATED("Spend related"),
    ENGAGEMENT("Engagement"),
    CONVERSION("Conversion");

    private final String label;

    MetricCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static MetricCategory of(MetricName metric) {
        return switch (metric) {
            case SPEND, CPA, CPC -> SPEND_RELATED;
            case IMPRESSIONS, CLICKS, CTR -> ENGAGEMENT;
            case CONVERSIONS, CVR, ROAS -> CONVERSION;
        };
    }
}
