package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Summary statistics of a historical metric series. Computed per evaluation, never stored.
 * Callers check {@link #getSampleSize()} before trusting z-score or IQR results.
 */
@Value
@Builder
public class Baseline {

    private static final Baseline EMPTY = Baseline.builder().build();

    double mean;
    double stdDev;
    double median;
    double min;
    double max;
    double q1;
    double q3;
    double iqr;
    double percentile95;
    int sampleSize;

    public static Baseline empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return sampleSize == 0;
    }
}
