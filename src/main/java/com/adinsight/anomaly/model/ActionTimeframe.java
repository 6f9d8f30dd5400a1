package com.adinsight.anomaly.model;

public enum ActionTimeframe {
    IMMEDIATE("immediately"),
    WITHIN_DAY("within a day"),
    WITHIN_WEEK("within a week"),
    LONG_TERM("long term");

    private final String label;

    ActionTimeframe(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
