package com.adinsight.anomaly.testutil;

import com.adinsight.anomaly.model.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Instant NOW = Instant.parse("2026-06-15T00:00:00Z");
    public static final LocalDate TODAY = LocalDate.of(2026, 6, 15);

    private TestDataFactory() {}

    public static Campaign createCampaign(String id) {
        return Campaign.builder()
                .id(id)
                .name("Campaign " + id)
                .industry(Industry.ECOMMERCE)
                .build();
    }

    public static Anomaly createAnomaly(String campaignId, MetricName metric, AnomalySeverity severity,
                                        double changePercent) {
        boolean increase = changePercent >= 0;
        double previous = 100.0;
        return Anomaly.builder()
                .id("anomaly_" + campaignId + "_" + metric.name().toLowerCase() + "_zscore_" + NOW.toEpochMilli())
                .campaignId(campaignId)
                .campaignName("Campaign " + campaignId)
                .type(increase ? AnomalyType.SPIKE : AnomalyType.DROP)
                .severity(severity)
                .metric(metric)
                .currentValue(previous * (1 + changePercent / 100.0))
                .previousValue(previous)
                .referenceValue(previous)
                .changePercent(changePercent)
                .message(metric.getLabel() + (increase ? " rose " : " fell ") + Math.abs(changePercent) + "%.")
                .detectedAt(NOW)
                .detectionMethod(DetectionMethod.ZSCORE)
                .zScore(increase ? 3.5 : -3.5)
                .historicalTrend(TrendDirection.STABLE)
                .recommendations(List.of("Review the campaign settings"))
                .build();
    }

    public static AlertDispatchRequest createDispatchRequest(String userId, List<Anomaly> anomalies) {
        return AlertDispatchRequest.builder()
                .userId(userId)
                .userEmail(userId + "@example.com")
                .userName("Test User")
                .anomalies(anomalies)
                .build();
    }

    public static AlertRecipient createRecipient(String userId) {
        return AlertRecipient.builder()
                .userId(userId)
                .email(userId + "@example.com")
                .name("Test User")
                .industry(Industry.ECOMMERCE)
                .build();
    }

    /**
     * One point per day ending at {@code end}, oldest first.
     */
    public static List<MetricPoint> series(LocalDate end, double... values) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(MetricPoint.of(end.minusDays(values.length - 1 - i), values[i]));
        }
        return points;
    }

    /**
     * {@code days} historical values alternating {@code mean - spread} and {@code mean + spread},
     * followed by {@code latest}. The history has exactly that mean and standard deviation {@code spread}.
     */
    public static double[] alternatingHistory(int days, double mean, double spread, double latest) {
        double[] values = new double[days + 1];
        for (int i = 0; i < days; i++) {
            values[i] = i % 2 == 0 ? mean - spread : mean + spread;
        }
        values[days] = latest;
        return values;
    }

    public static KpiSnapshot createSnapshot(String campaignId, LocalDate date, double spend, long conversions) {
        return KpiSnapshot.builder()
                .campaignId(campaignId)
                .date(date)
                .impressions(10_000)
                .clicks(200)
                .spend(spend)
                .conversions(conversions)
                .revenue(spend * 3)
                .build();
    }
}
