package com.adinsight.anomaly.model;

/**
 * Anomaly severity. Declaration order is urgency order: CRITICAL first.
 */
public enum AnomalySeverity {
    CRITICAL,
    WARNING,
    INFO;

    /**
     * Whether this severity is at least as urgent as {@code minimum}.
     * With minimum WARNING, CRITICAL and WARNING qualify and INFO does not.
     */
    public boolean isAtLeast(AnomalySeverity minimum) {
        return ordinal() <= minimum.ordinal();
    }

    /** One level more urgent, saturating at CRITICAL. */
    public AnomalySeverity escalate() {
        return switch (this) {
            case INFO -> WARNING;
            case WARNING, CRITICAL -> CRITICAL;
        };
    }
}
