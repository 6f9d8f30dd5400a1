package com.adinsight.anomaly.engine.statistics;

import com.adinsight.anomaly.model.TrendDirection;

import java.util.Arrays;

/**
 * Closed-form statistics over daily metric series.
 *
 * <p>Every function is total: empty input, a single observation or zero variance
 * yield deterministic zeros, never NaN, infinity or an exception.</p>
 */
public final class StatisticsToolkit {

    /** Default relative change between half-series means that counts as a trend, in percent. */
    public static final double DEFAULT_TREND_GROWTH_PCT = 15.0;

    /** Default coefficient of variation above which a series is volatile, in percent. */
    public static final double DEFAULT_VOLATILITY_CV_PCT = 50.0;

    /** Minimum series length before a trend is classified. */
    static final int MIN_TREND_POINTS = 3;

    private StatisticsToolkit() {}

    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divides by N).
     */
    public static double stdDev(double[] values, double mean) {
        if (values == null || values.length <= 1) {
            return 0.0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        double variance = sumSquaredDiff / values.length;
        return variance > 0 ? Math.sqrt(variance) : 0.0;
    }

    /**
     * Percentile by linear interpolation at index {@code p / 100 * (n - 1)}.
     *
     * @param sortedValues ascending values
     * @param p            percentile in [0, 100]
     */
    public static double percentile(double[] sortedValues, double p) {
        if (sortedValues == null || sortedValues.length == 0) {
            return 0.0;
        }
        if (sortedValues.length == 1) {
            return sortedValues[0];
        }
        double clamped = Math.max(0.0, Math.min(100.0, p));
        double index = clamped / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev == 0) {
            return 0.0;
        }
        return (value - mean) / stdDev;
    }

    /**
     * Distance outside the interquartile box in units of IQR. Zero inside [q1, q3]
     * or when the IQR is zero. Values above 1.5 are conventionally outliers.
     */
    public static double iqrDistance(double value, double q1, double q3, double iqr) {
        if (iqr == 0) {
            return 0.0;
        }
        if (value < q1) {
            return (q1 - value) / iqr;
        }
        if (value > q3) {
            return (value - q3) / iqr;
        }
        return 0.0;
    }

    /**
     * Sliding mean over contiguous windows; the result has {@code max(0, n - window + 1)} entries.
     */
    public static double[] movingAverage(double[] values, int window) {
        if (values == null || window <= 0 || values.length < window) {
            return new double[0];
        }
        double[] result = new double[values.length - window + 1];
        double sum = 0;
        for (int i = 0; i < window; i++) {
            sum += values[i];
        }
        result[0] = sum / window;
        for (int i = window; i < values.length; i++) {
            sum += values[i] - values[i - window];
            result[i - window + 1] = sum / window;
        }
        return result;
    }

    /**
     * Standard deviation relative to the absolute mean, in percent. Zero when the mean is zero.
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0) {
            return 0.0;
        }
        return stdDev(values, mean) / Math.abs(mean) * 100.0;
    }

    public static TrendDirection detectTrend(double[] values) {
        return detectTrend(values, DEFAULT_TREND_GROWTH_PCT, DEFAULT_VOLATILITY_CV_PCT);
    }

    /**
     * Classifies a chronological series by comparing the means of its first and second halves.
     * Volatility takes precedence over direction.
     *
     * @param growthThresholdPct relative change between half means that counts as a trend
     * @param volatilityCvPct    coefficient of variation above which the series is volatile
     */
    public static TrendDirection detectTrend(double[] values, double growthThresholdPct, double volatilityCvPct) {
        if (values == null || values.length < MIN_TREND_POINTS) {
            return TrendDirection.STABLE;
        }
        if (coefficientOfVariation(values) > volatilityCvPct) {
            return TrendDirection.VOLATILE;
        }

        int half = values.length / 2;
        double firstMean = mean(Arrays.copyOfRange(values, 0, half));
        double secondMean = mean(Arrays.copyOfRange(values, half, values.length));

        if (firstMean == 0) {
            if (secondMean > 0) return TrendDirection.INCREASING;
            if (secondMean < 0) return TrendDirection.DECREASING;
            return TrendDirection.STABLE;
        }

        double growthPct = (secondMean - firstMean) / Math.abs(firstMean) * 100.0;
        if (growthPct > growthThresholdPct) {
            return TrendDirection.INCREASING;
        }
        if (growthPct < -growthThresholdPct) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }
}
