package com.adinsight.anomaly.model;

public enum SkipReason {
    BELOW_SEVERITY,
    RATE_LIMITED,
    DUPLICATE,
    EMAIL_DISABLED,
    DEADLINE_REACHED,
    DELIVERY_FAILED
}
