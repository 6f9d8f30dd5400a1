package com.adinsight.anomaly.model;

public enum DetectionMethod {
    ZSCORE("Z-score analysis"),
    IQR("Interquartile range analysis"),
    MOVING_AVERAGE("Moving average deviation"),
    THRESHOLD("Day-over-day threshold");

    private final String label;

    DetectionMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
