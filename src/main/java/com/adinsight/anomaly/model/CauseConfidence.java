package com.adinsight.anomaly.model;

/**
 * Confidence in a cause, strongest first.
 */
public enum CauseConfidence {
    HIGH(0.7),
    MEDIUM(0.5),
    LOW(0.3);

    private final double baseProbability;

    CauseConfidence(double baseProbability) {
        this.baseProbability = baseProbability;
    }

    public double getBaseProbability() {
        return baseProbability;
    }

    public CauseConfidence raise() {
        return this == LOW ? MEDIUM : HIGH;
    }

    public CauseConfidence lower() {
        return this == HIGH ? MEDIUM : LOW;
    }
}
