package com.adinsight.anomaly.engine.calendar;

import lombok.Value;

/**
 * Closed range of expected percentage change.
 */
@Value
public class ChangeRange {

    public static final ChangeRange ZERO = new ChangeRange(0, 0);

    double min;
    double max;

    public static ChangeRange of(double min, double max) {
        return new ChangeRange(min, max);
    }

    public boolean contains(double changePercent) {
        return changePercent >= min && changePercent <= max;
    }

    /** Both ends multiplied by the weight and rounded to whole percent. */
    public ChangeRange scale(double weight) {
        return new ChangeRange(Math.round(min * weight), Math.round(max * weight));
    }

    /** Smallest range covering both. */
    public ChangeRange union(ChangeRange other) {
        return new ChangeRange(Math.min(min, other.min), Math.max(max, other.max));
    }

    public double widestBound() {
        return Math.max(Math.abs(min), Math.abs(max));
    }
}
