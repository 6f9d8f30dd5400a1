package com.adinsight.anomaly.config;

import com.adinsight.anomaly.model.AnomalySeverity;
import com.adinsight.anomaly.model.MetricName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.detection")
public class DetectionConfig {

    // Metrics evaluated per campaign
    private List<MetricName> metrics = List.of(
            MetricName.SPEND, MetricName.CTR, MetricName.CPA,
            MetricName.ROAS, MetricName.CONVERSIONS, MetricName.CPC);

    // Days of history read before the evaluation date
    private int historyDays = 30;

    // Minimum historical points for IQR and moving-average detection.
    // Below this the day-over-day threshold path is used.
    private int minDataPoints = 7;

    // Minimum historical points for z-score detection
    private int minDataPointsForZScore = 14;

    private double zScoreThreshold = 2.5;

    // z-score threshold multiplier on special days
    private double specialDayZScoreMultiplier = 1.2;

    private double iqrThreshold = 1.5;

    private int movingAverageWindow = 7;
    private double movingAverageDeviationPct = 30.0;

    // Day-over-day thresholds in percent
    private double spikeThresholdPct = 50.0;
    private double dropThresholdPct = -30.0;

    // Adverse moves whose z-score, IQR distance or deviation ratio exceeds this escalate one level
    private double escalationMagnitude = 4.0;

    // Spend swings at least this multiple of the spike threshold are at least WARNING
    private double budgetSwingMultiplier = 1.5;

    private boolean calendarEnabled = true;

    // Campaigns evaluated concurrently
    private int parallelism = 4;

    // Upper bound on reading and evaluating one campaign
    private int campaignTimeoutSeconds = 30;

    private Trend trend = new Trend();

    // Per-metric severity overrides; unset metrics use the defaults on MetricName
    private Map<MetricName, SeverityRule> severity = new EnumMap<>(MetricName.class);

    @Data
    public static class Trend {
        // Relative change between half-series means that counts as a trend
        private double growthThresholdPct = 15.0;
        // Coefficient of variation above which a series is volatile
        private double volatilityCvPct = 50.0;
        // Historical points considered for the trend
        private int window = 7;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeverityRule {
        private AnomalySeverity spike;
        private AnomalySeverity drop;
    }
}
