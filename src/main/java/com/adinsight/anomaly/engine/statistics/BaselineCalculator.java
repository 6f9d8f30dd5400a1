package com.adinsight.anomaly.engine.statistics;

import com.adinsight.anomaly.model.Baseline;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Turns a chronological series of daily values into a {@link Baseline}.
 */
@Component
public class BaselineCalculator {

    public Baseline calculate(double[] values) {
        if (values == null || values.length == 0) {
            return Baseline.empty();
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double mean = StatisticsToolkit.mean(values);
        double q1 = StatisticsToolkit.percentile(sorted, 25);
        double q3 = StatisticsToolkit.percentile(sorted, 75);

        return Baseline.builder()
                .mean(mean)
                .stdDev(StatisticsToolkit.stdDev(values, mean))
                .median(StatisticsToolkit.percentile(sorted, 50))
                .min(sorted[0])
                .max(sorted[sorted.length - 1])
                .q1(q1)
                .q3(q3)
                .iqr(q3 - q1)
                .percentile95(StatisticsToolkit.percentile(sorted, 95))
                .sampleSize(values.length)
                .build();
    }
}
