package com.adinsight.anomaly.model;

/**
 * Priority of a recommended action, most urgent first.
 */
public enum ActionPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public boolean isAtLeast(ActionPriority minimum) {
        return ordinal() <= minimum.ordinal();
    }
}
