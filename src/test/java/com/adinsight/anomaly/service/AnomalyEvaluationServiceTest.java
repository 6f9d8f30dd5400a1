package com.adinsight.anomaly.service;

import com.adinsight.anomaly.config.MetricsConfig;
import com.adinsight.anomaly.engine.calendar.MarketCalendarProvider;
import com.adinsight.anomaly.engine.detection.AnomalyDetector;
import com.adinsight.anomaly.engine.rootcause.RootCauseAnalyzer;
import com.adinsight.anomaly.engine.segment.AnomalySegmentAnalyzer;
import com.adinsight.anomaly.model.*;
import com.adinsight.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyEvaluationServiceTest {

    @Mock private AnomalyDetector detector;
    @Mock private RootCauseAnalyzer rootCauseAnalyzer;
    @Mock private AnomalyAlertDispatcher dispatcher;

    private final MarketCalendarProvider calendarProvider = new MarketCalendarProvider();
    private SimpleMeterRegistry registry;
    private AnomalyEvaluationService service;

    private final AlertRecipient recipient = TestDataFactory.createRecipient("user-1");
    private final Instant deadline = TestDataFactory.NOW.plusSeconds(300);

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC);
        service = new AnomalyEvaluationService(detector, rootCauseAnalyzer, new AnomalySegmentAnalyzer(clock),
                dispatcher, calendarProvider, new MetricsConfig(registry), clock);
    }

    private static DetectionResult detected(boolean complete, Anomaly... anomalies) {
        return DetectionResult.builder()
                .anomalies(List.of(anomalies))
                .campaignsEvaluated(1)
                .complete(complete)
                .build();
    }

    private static RootCauseAnalysis analysisFor(Anomaly anomaly) {
        return RootCauseAnalysis.builder()
                .anomalyId(anomaly.getId())
                .metric(anomaly.getMetric())
                .topCauses(List.of())
                .allCauses(List.of())
                .urgencyLevel(UrgencyLevel.MEDIUM)
                .summary("summary")
                .nextSteps(List.of())
                .build();
    }

    @Test
    void evaluate_anomaliesFound_analyzesEachAndDispatchesAll() {
        Anomaly spend = TestDataFactory.createAnomaly("c1", MetricName.SPEND, AnomalySeverity.CRITICAL, 120);
        Anomaly ctr = TestDataFactory.createAnomaly("c1", MetricName.CTR, AnomalySeverity.WARNING, -45);
        when(detector.detectAnomalies("user-1", Industry.ECOMMERCE, deadline)).thenReturn(detected(true, spend, ctr));
        when(rootCauseAnalyzer.analyzeRootCause(eq(spend), any())).thenReturn(analysisFor(spend));
        when(rootCauseAnalyzer.analyzeRootCause(eq(ctr), any())).thenReturn(analysisFor(ctr));
        AlertDispatchResult dispatch = AlertDispatchResult.builder()
                .sent(List.of(spend, ctr)).skipped(List.of()).errors(List.of()).build();
        when(dispatcher.sendAlerts(any(), eq(deadline))).thenReturn(dispatch);

        EvaluationReport report = service.evaluate(recipient, deadline);

        assertThat(report.getUserId()).isEqualTo("user-1");
        assertThat(report.getEvaluatedAt()).isEqualTo(TestDataFactory.NOW);
        assertThat(report.total()).isEqualTo(2);
        assertThat(report.getAnomalies()).extracting(AnalyzedAnomaly::getAnomaly).containsExactly(spend, ctr);
        assertThat(report.getCountsBySeverity())
                .containsEntry(AnomalySeverity.CRITICAL, 1L)
                .containsEntry(AnomalySeverity.WARNING, 1L);
        assertThat(report.getCountsByType())
                .containsEntry(AnomalyType.SPIKE, 1L)
                .containsEntry(AnomalyType.DROP, 1L);
        assertThat(report.getDispatch()).isSameAs(dispatch);
        assertThat(report.isComplete()).isTrue();
        assertThat(report.getMarketEvents()).isEqualTo(calendarProvider.forDate(TestDataFactory.TODAY)
                .getDateEventInfo(TestDataFactory.TODAY, Industry.ECOMMERCE).eventNames());
        assertThat(report.getSegments().getSegments()).extracting(SegmentAnalysis.SegmentDetail::getName)
                .containsExactly("Campaign c1");
        assertThat(report.getSegments().getPropagation().getChain()).containsExactly(MetricName.SPEND, MetricName.CTR);

        ArgumentCaptor<AlertDispatchRequest> request = ArgumentCaptor.forClass(AlertDispatchRequest.class);
        verify(dispatcher).sendAlerts(request.capture(), eq(deadline));
        assertThat(request.getValue().getUserEmail()).isEqualTo("user-1@example.com");
        assertThat(request.getValue().getAnomalies()).containsExactly(spend, ctr);
        assertThat(registry.find("evaluation.run.count").tag("status", "complete").counter().count()).isEqualTo(1.0);
    }

    @Test
    void evaluate_passesTodayAndIndustryToAnalyzer() {
        Anomaly cpa = TestDataFactory.createAnomaly("c1", MetricName.CPA, AnomalySeverity.WARNING, 60);
        when(detector.detectAnomalies("user-1", Industry.ECOMMERCE, deadline)).thenReturn(detected(true, cpa));
        when(rootCauseAnalyzer.analyzeRootCause(eq(cpa), any())).thenReturn(analysisFor(cpa));
        when(dispatcher.sendAlerts(any(), eq(deadline))).thenReturn(AlertDispatchResult.empty());

        service.evaluate(recipient, deadline);

        ArgumentCaptor<AnalysisContext> context = ArgumentCaptor.forClass(AnalysisContext.class);
        verify(rootCauseAnalyzer).analyzeRootCause(eq(cpa), context.capture());
        assertThat(context.getValue().getCurrentDate()).isEqualTo(TestDataFactory.TODAY);
        assertThat(context.getValue().getIndustry()).isEqualTo(Industry.ECOMMERCE);
        assertThat(context.getValue().getHistoricalPattern()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void evaluate_noAnomalies_reportsEmptyAndComplete() {
        when(detector.detectAnomalies("user-1", Industry.ECOMMERCE, deadline)).thenReturn(detected(true));
        when(dispatcher.sendAlerts(any(), eq(deadline))).thenReturn(AlertDispatchResult.empty());

        EvaluationReport report = service.evaluate(recipient, deadline);

        assertThat(report.total()).isZero();
        assertThat(report.getCountsBySeverity()).isEmpty();
        assertThat(report.getSegments().getSegments()).isEmpty();
        assertThat(report.getSegments().getPropagation()).isNull();
        assertThat(report.isComplete()).isTrue();
        verify(rootCauseAnalyzer, never()).analyzeRootCause(any(), any());
    }

    @Test
    void evaluate_detectionCutShort_reportsPartial() {
        when(detector.detectAnomalies("user-1", Industry.ECOMMERCE, deadline)).thenReturn(detected(false));
        when(dispatcher.sendAlerts(any(), eq(deadline))).thenReturn(AlertDispatchResult.empty());

        EvaluationReport report = service.evaluate(recipient, deadline);

        assertThat(report.isComplete()).isFalse();
        assertThat(registry.find("evaluation.run.count").tag("status", "partial").counter().count()).isEqualTo(1.0);
    }

    @Test
    void evaluate_dispatchHitDeadline_reportsPartial() {
        Anomaly ctr = TestDataFactory.createAnomaly("c1", MetricName.CTR, AnomalySeverity.WARNING, -45);
        when(detector.detectAnomalies("user-1", Industry.ECOMMERCE, deadline)).thenReturn(detected(true, ctr));
        when(rootCauseAnalyzer.analyzeRootCause(eq(ctr), any())).thenReturn(analysisFor(ctr));
        when(dispatcher.sendAlerts(any(), eq(deadline))).thenReturn(AlertDispatchResult.builder()
                .sent(List.of())
                .skipped(List.of(SkippedAlert.of(ctr, SkipReason.DEADLINE_REACHED, "deadline passed")))
                .errors(List.of())
                .build());

        EvaluationReport report = service.evaluate(recipient, deadline);

        assertThat(report.isComplete()).isFalse();
    }
}
