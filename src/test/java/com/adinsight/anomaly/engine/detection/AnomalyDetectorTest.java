package com.adinsight.anomaly.engine.detection;

import com.adinsight.anomaly.config.DetectionConfig;
import com.adinsight.anomaly.config.MetricsConfig;
import com.adinsight.anomaly.engine.calendar.MarketCalendarProvider;
import com.adinsight.anomaly.engine.statistics.BaselineCalculator;
import com.adinsight.anomaly.model.*;
import com.adinsight.anomaly.port.CampaignLister;
import com.adinsight.anomaly.port.KpiReader;
import com.adinsight.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectorTest {

    private static final Instant CHRISTMAS_MORNING = Instant.parse("2026-12-25T03:00:00Z");

    @Mock private KpiReader kpiReader;
    @Mock private CampaignLister campaignLister;

    private DetectionConfig config;
    private SimpleMeterRegistry registry;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        config = new DetectionConfig();
        registry = new SimpleMeterRegistry();
        campaign = Campaign.builder().id("c1").name("Summer Sale").build();
    }

    private AnomalyDetector detector(Instant now, Executor executor) {
        return new AnomalyDetector(kpiReader, campaignLister, new BaselineCalculator(),
                new MarketCalendarProvider(), new SeverityPolicy(config), config,
                new MetricsConfig(registry), Tracer.NOOP, executor, Clock.fixed(now, ZoneOffset.UTC));
    }

    private AnomalyDetector detector() {
        return detector(TestDataFactory.NOW, Runnable::run);
    }

    private void givenSeries(String campaignId, MetricName metric, LocalDate today, double... values) {
        when(kpiReader.seriesFor(eq(campaignId), eq(metric), any()))
                .thenReturn(TestDataFactory.series(today, values));
    }

    @Test
    void detectCampaignAnomalies_cpaFarAboveStableHistory_flagsCriticalZScoreSpike() {
        config.setMetrics(List.of(MetricName.CPA));
        givenSeries("c1", MetricName.CPA, TestDataFactory.TODAY,
                TestDataFactory.alternatingHistory(14, 15000, 500, 25000));

        List<Anomaly> anomalies = detector().detectCampaignAnomalies(campaign, null);

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.ZSCORE);
        assertThat(anomaly.getZScore()).isCloseTo(20.0, within(1e-9));
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.SPIKE);
        assertThat(anomaly.getReferenceValue()).isEqualTo(15000.0);
        assertThat(anomaly.getChangePercent()).isCloseTo(66.67, within(0.01));
        assertThat(anomaly.getCurrentValue()).isEqualTo(25000.0);
        assertThat(anomaly.getPreviousValue()).isEqualTo(15500.0);
        assertThat(anomaly.getId()).isEqualTo("anomaly_c1_cpa_zscore_" + TestDataFactory.NOW.toEpochMilli());
        assertThat(anomaly.getCampaignName()).isEqualTo("Summer Sale");
        assertThat(anomaly.getRecommendations()).isNotEmpty().hasSizeLessThanOrEqualTo(3);
        assertThat(anomaly.getMarketContext().isSpecialDay()).isFalse();
        assertThat(registry.find("anomaly.detected.count").tag("metric", "CPA").counter().count()).isEqualTo(1.0);
    }

    @Test
    void detectCampaignAnomalies_cpaWithinThreshold_isNotFlagged() {
        config.setMetrics(List.of(MetricName.CPA));
        givenSeries("c1", MetricName.CPA, TestDataFactory.TODAY,
                TestDataFactory.alternatingHistory(14, 15000, 500, 15600));

        assertThat(detector().detectCampaignAnomalies(campaign, null)).isEmpty();
    }

    @Test
    void detectCampaignAnomalies_favourableRoasJump_isNotEscalated() {
        config.setMetrics(List.of(MetricName.ROAS));
        givenSeries("c1", MetricName.ROAS, TestDataFactory.TODAY,
                TestDataFactory.alternatingHistory(14, 3.0, 0.1, 4.5));

        Anomaly anomaly = detector().detectCampaignAnomalies(campaign, null).get(0);

        assertThat(Math.abs(anomaly.getZScore())).isGreaterThan(config.getEscalationMagnitude());
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.INFO);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.SPIKE);
        assertThat(anomaly.isAdverse()).isFalse();
    }

    @Test
    void detectCampaignAnomalies_shortHistoryWithSpread_usesIqrAgainstMedian() {
        config.setMetrics(List.of(MetricName.CTR));
        givenSeries("c1", MetricName.CTR, TestDataFactory.TODAY,
                2.0, 2.1, 1.9, 2.0, 2.1, 1.9, 2.0, 2.05, 1.0);

        Anomaly anomaly = detector().detectCampaignAnomalies(campaign, null).get(0);

        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.IQR);
        assertThat(anomaly.getIqrDistance()).isCloseTo(11.14, within(0.01));
        assertThat(anomaly.getReferenceValue()).isCloseTo(2.0, within(1e-9));
        assertThat(anomaly.getChangePercent()).isCloseTo(-50.0, within(1e-9));
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.DROP);
        // CTR drops default to WARNING and escalate once the distance passes 4
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(anomaly.getZScore()).isNull();
    }

    @Test
    void detectCampaignAnomalies_flatHistory_fallsBackToMovingAverage() {
        config.setMetrics(List.of(MetricName.CPC));
        givenSeries("c1", MetricName.CPC, TestDataFactory.TODAY,
                100, 100, 100, 100, 100, 100, 100, 100, 150);

        Anomaly anomaly = detector().detectCampaignAnomalies(campaign, null).get(0);

        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.MOVING_AVERAGE);
        assertThat(anomaly.getReferenceValue()).isEqualTo(100.0);
        assertThat(anomaly.getChangePercent()).isCloseTo(50.0, within(1e-9));
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
    }

    @Test
    void detectCampaignAnomalies_twoPointsOnOrdinaryDay_usesDayOverDayThreshold() {
        config.setMetrics(List.of(MetricName.SPEND));
        givenSeries("c1", MetricName.SPEND, TestDataFactory.TODAY, 1000, 1700);

        Anomaly anomaly = detector().detectCampaignAnomalies(campaign, null).get(0);

        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.THRESHOLD);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.BUDGET_ANOMALY);
        assertThat(anomaly.getChangePercent()).isCloseTo(70.0, within(1e-9));
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
    }

    @Test
    void detectCampaignAnomalies_christmasSpendRise_widensThresholdOnFastPath() {
        config.setMetrics(List.of(MetricName.SPEND));
        LocalDate christmas = LocalDate.of(2026, 12, 25);
        givenSeries("c1", MetricName.SPEND, christmas, 1000, 1700);

        assertThat(detector(CHRISTMAS_MORNING, Runnable::run).detectCampaignAnomalies(campaign, null)).isEmpty();
    }

    @Test
    void detectCampaignAnomalies_christmasSpendRiseWithinExpectedRange_isSuppressed() {
        config.setMetrics(List.of(MetricName.SPEND));
        LocalDate christmas = LocalDate.of(2026, 12, 25);
        givenSeries("c1", MetricName.SPEND, christmas, TestDataFactory.alternatingHistory(14, 1000, 50, 1700));

        List<Anomaly> anomalies = detector(CHRISTMAS_MORNING, Runnable::run).detectCampaignAnomalies(campaign, null);

        assertThat(anomalies).isEmpty();
        assertThat(registry.find("anomaly.suppressed.count").tag("metric", "SPEND").counter().count()).isEqualTo(1.0);
    }

    @Test
    void detectCampaignAnomalies_christmasSpendRiseBeyondExpectedRange_carriesMarketContext() {
        config.setMetrics(List.of(MetricName.SPEND));
        LocalDate christmas = LocalDate.of(2026, 12, 25);
        givenSeries("c1", MetricName.SPEND, christmas, TestDataFactory.alternatingHistory(14, 1000, 50, 2500));

        Anomaly anomaly = detector(CHRISTMAS_MORNING, Runnable::run).detectCampaignAnomalies(campaign, null).get(0);

        assertThat(anomaly.getChangePercent()).isCloseTo(150.0, within(1e-9));
        assertThat(anomaly.getMarketContext().isSpecialDay()).isTrue();
        assertThat(anomaly.getMarketContext().getEvents()).contains("Christmas");
        assertThat(anomaly.getMarketContext().getExpectedMaxChange()).isEqualTo(100.0);
        assertThat(anomaly.getMarketContext().isWithinExpectedRange()).isFalse();
    }

    @Test
    void detectCampaignAnomalies_noSeries_fallsBackToLatestSnapshots() {
        config.setMetrics(List.of(MetricName.SPEND));
        when(kpiReader.seriesFor(eq("c1"), eq(MetricName.SPEND), any())).thenReturn(List.of());
        when(kpiReader.latestTwo("c1")).thenReturn(List.of(
                TestDataFactory.createSnapshot("c1", TestDataFactory.TODAY.minusDays(1), 1000, 10),
                TestDataFactory.createSnapshot("c1", TestDataFactory.TODAY, 400, 4)));

        Anomaly anomaly = detector().detectCampaignAnomalies(campaign, null).get(0);

        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.THRESHOLD);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.DROP);
        assertThat(anomaly.getChangePercent()).isCloseTo(-60.0, within(1e-9));
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.INFO);
    }

    @Test
    void detectCampaignAnomalies_singleDataPoint_isSkipped() {
        config.setMetrics(List.of(MetricName.SPEND));
        when(kpiReader.seriesFor(eq("c1"), eq(MetricName.SPEND), any()))
                .thenReturn(TestDataFactory.series(TestDataFactory.TODAY, 1000));
        when(kpiReader.latestTwo("c1")).thenReturn(List.of(
                TestDataFactory.createSnapshot("c1", TestDataFactory.TODAY, 1000, 10)));

        assertThat(detector().detectCampaignAnomalies(campaign, null)).isEmpty();
    }

    @Test
    void detectCampaignAnomalies_zeroPreviousValue_skipsThresholdPath() {
        config.setMetrics(List.of(MetricName.CONVERSIONS));
        givenSeries("c1", MetricName.CONVERSIONS, TestDataFactory.TODAY, 0, 25);

        assertThat(detector().detectCampaignAnomalies(campaign, null)).isEmpty();
    }

    @Test
    void detectCampaignAnomalies_oneMetricFails_othersStillEvaluated() {
        config.setMetrics(List.of(MetricName.SPEND, MetricName.CPA));
        when(kpiReader.seriesFor(eq("c1"), eq(MetricName.SPEND), any()))
                .thenThrow(new IllegalStateException("warehouse unavailable"));
        givenSeries("c1", MetricName.CPA, TestDataFactory.TODAY,
                TestDataFactory.alternatingHistory(14, 15000, 500, 25000));

        List<Anomaly> anomalies = detector().detectCampaignAnomalies(campaign, null);

        assertThat(anomalies).extracting(Anomaly::getMetric).containsExactly(MetricName.CPA);
    }

    @Test
    void detectCampaignAnomalies_unknownCampaign_throws() {
        when(campaignLister.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> detector().detectCampaignAnomalies("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void detectAnomalies_multipleCampaigns_sortedBySeverity() {
        config.setMetrics(List.of(MetricName.ROAS, MetricName.CPA));
        Campaign second = Campaign.builder().id("c2").name("Brand").build();
        when(campaignLister.activeCampaigns("user-1")).thenReturn(List.of(campaign, second));
        givenSeries("c1", MetricName.ROAS, TestDataFactory.TODAY, TestDataFactory.alternatingHistory(14, 3.0, 0.1, 4.5));
        givenSeries("c1", MetricName.CPA, TestDataFactory.TODAY, TestDataFactory.alternatingHistory(14, 15000, 500, 15000));
        givenSeries("c2", MetricName.ROAS, TestDataFactory.TODAY, TestDataFactory.alternatingHistory(14, 3.0, 0.1, 3.0));
        givenSeries("c2", MetricName.CPA, TestDataFactory.TODAY, TestDataFactory.alternatingHistory(14, 15000, 500, 25000));

        DetectionResult result = detector().detectAnomalies("user-1", Industry.ECOMMERCE, null);

        assertThat(result.getAnomalies()).extracting(Anomaly::getCampaignId).containsExactly("c2", "c1");
        assertThat(result.getAnomalies()).extracting(Anomaly::getSeverity)
                .containsExactly(AnomalySeverity.CRITICAL, AnomalySeverity.INFO);
        assertThat(result.getCampaignsEvaluated()).isEqualTo(2);
        assertThat(result.getCampaignsFailed()).isZero();
        assertThat(result.isComplete()).isTrue();
    }

    @Test
    void detectAnomalies_deadlineReached_returnsPartialResult() {
        when(campaignLister.activeCampaigns("user-1")).thenReturn(List.of(campaign));
        Executor neverRuns = task -> { };

        DetectionResult result = detector(TestDataFactory.NOW, neverRuns)
                .detectAnomalies("user-1", null, TestDataFactory.NOW);

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getCampaignsFailed()).isEqualTo(1);
        assertThat(result.isComplete()).isFalse();
        verify(kpiReader, never()).seriesFor(any(), any(), any());
    }

    @Test
    void detectAnomalies_noCampaigns_returnsEmptyCompleteResult() {
        when(campaignLister.activeCampaigns("user-1")).thenReturn(List.of());

        List<Anomaly> anomalies = detector().detectAnomalies("user-1");

        assertThat(anomalies).isEmpty();
    }

    @Test
    void detectCampaignAnomalies_roasHalvedAgainstStableBaseline_flagsCriticalDrop() {
        config.setMetrics(List.of(MetricName.ROAS));
        givenSeries("c1", MetricName.ROAS, TestDataFactory.TODAY,
                TestDataFactory.alternatingHistory(14, 3.0, 0.1, 1.5));

        Anomaly anomaly = detector().detectCampaignAnomalies(campaign, null).get(0);

        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.ZSCORE);
        assertThat(anomaly.getReferenceValue()).isCloseTo(3.0, within(1e-9));
        assertThat(anomaly.getChangePercent()).isCloseTo(-50.0, within(1e-9));
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.DROP);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
    }

    @Test
    void detectCampaignAnomalies_zeroMedianHistory_measuresAgainstUpperQuartile() {
        config.setMetrics(List.of(MetricName.SPEND));
        givenSeries("c1", MetricName.SPEND, TestDataFactory.TODAY, 0, 0, 0, 0, 0, 50, 100, 5000);

        Anomaly anomaly = detector().detectCampaignAnomalies(campaign, null).get(0);

        assertThat(anomaly.getDetectionMethod()).isEqualTo(DetectionMethod.IQR);
        assertThat(anomaly.getReferenceValue()).isCloseTo(25.0, within(1e-9));
        assertThat(anomaly.getChangePercent()).isCloseTo(19900.0, within(1e-6));
        assertThat(anomaly.getMessage()).doesNotContain(" 0%");
    }

    @Test
    void detectCampaignAnomalies_zeroMedianHistoryOnLunarNewYear_isNotSuppressed() {
        config.setMetrics(List.of(MetricName.SPEND));
        LocalDate seollal = LocalDate.of(2026, 2, 17);
        givenSeries("c1", MetricName.SPEND, seollal, 0, 0, 0, 0, 0, 50, 100, 5000);

        List<Anomaly> anomalies = detector(Instant.parse("2026-02-17T03:00:00Z"), Runnable::run)
                .detectCampaignAnomalies(campaign, null);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getMarketContext().isSpecialDay()).isTrue();
        assertThat(registry.find("anomaly.suppressed.count").counter()).isNull();
    }

    @Test
    void detectAnomalies_campaignsQueuedOnBusyPool_eachGetTheirOwnTimeout() {
        config.setMetrics(List.of(MetricName.SPEND));
        config.setCampaignTimeoutSeconds(1);
        Campaign second = Campaign.builder().id("c2").name("Brand").build();
        Campaign third = Campaign.builder().id("c3").name("Retargeting").build();
        when(campaignLister.activeCampaigns("user-1")).thenReturn(List.of(campaign, second, third));
        when(kpiReader.seriesFor(any(), eq(MetricName.SPEND), any())).thenAnswer(invocation -> {
            Thread.sleep(400);
            return TestDataFactory.series(TestDataFactory.TODAY, 1000, 1700);
        });

        ExecutorService singleWorker = Executors.newSingleThreadExecutor();
        try {
            DetectionResult result = slowDetector(singleWorker).detectAnomalies("user-1", null, null);

            assertThat(result.getCampaignsEvaluated()).isEqualTo(3);
            assertThat(result.getCampaignsFailed()).isZero();
            assertThat(result.getAnomalies()).hasSize(3);
            assertThat(result.isComplete()).isTrue();
        } finally {
            singleWorker.shutdownNow();
        }
    }

    @Test
    void detectAnomalies_campaignExceedsItsTimeout_isDroppedAndResultMarkedPartial() {
        config.setMetrics(List.of(MetricName.SPEND));
        config.setCampaignTimeoutSeconds(1);
        Campaign second = Campaign.builder().id("c2").name("Brand").build();
        when(campaignLister.activeCampaigns("user-1")).thenReturn(List.of(campaign, second));
        when(kpiReader.seriesFor(eq("c1"), eq(MetricName.SPEND), any())).thenAnswer(invocation -> {
            Thread.sleep(1500);
            return TestDataFactory.series(TestDataFactory.TODAY, 1000, 1700);
        });
        givenSeries("c2", MetricName.SPEND, TestDataFactory.TODAY, 1000, 1700);

        ExecutorService singleWorker = Executors.newSingleThreadExecutor();
        try {
            DetectionResult result = slowDetector(singleWorker).detectAnomalies("user-1", null, null);

            assertThat(result.getCampaignsFailed()).isEqualTo(1);
            assertThat(result.getAnomalies()).extracting(Anomaly::getCampaignId).containsExactly("c2");
            assertThat(result.isComplete()).isFalse();
        } finally {
            singleWorker.shutdownNow();
        }
    }

    private AnomalyDetector slowDetector(Executor executor) {
        return new AnomalyDetector(kpiReader, campaignLister, new BaselineCalculator(),
                new MarketCalendarProvider(), new SeverityPolicy(config), config,
                new MetricsConfig(registry), Tracer.NOOP, executor, Clock.systemUTC());
    }
}
