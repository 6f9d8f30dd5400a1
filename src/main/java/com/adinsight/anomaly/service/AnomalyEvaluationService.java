package com.adinsight.anomaly.service;

import com.adinsight.anomaly.config.MetricsConfig;
import com.adinsight.anomaly.engine.calendar.MarketCalendarProvider;
import com.adinsight.anomaly.engine.detection.AnomalyDetector;
import com.adinsight.anomaly.engine.rootcause.RootCauseAnalyzer;
import com.adinsight.anomaly.engine.segment.AnomalySegmentAnalyzer;
import com.adinsight.anomaly.model.AlertDispatchRequest;
import com.adinsight.anomaly.model.AlertDispatchResult;
import com.adinsight.anomaly.model.AlertRecipient;
import com.adinsight.anomaly.model.AnalysisContext;
import com.adinsight.anomaly.model.AnalyzedAnomaly;
import com.adinsight.anomaly.model.Anomaly;
import com.adinsight.anomaly.model.AnomalySeverity;
import com.adinsight.anomaly.model.AnomalyType;
import com.adinsight.anomaly.model.DetectionResult;
import com.adinsight.anomaly.model.EvaluationReport;
import com.adinsight.anomaly.model.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One user's evaluation run: detect, explain, then alert.
 */
@Service
public class AnomalyEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEvaluationService.class);

    private final AnomalyDetector detector;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final AnomalySegmentAnalyzer segmentAnalyzer;
    private final AnomalyAlertDispatcher dispatcher;
    private final MarketCalendarProvider calendarProvider;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyEvaluationService(AnomalyDetector detector,
                                    RootCauseAnalyzer rootCauseAnalyzer,
                                    AnomalySegmentAnalyzer segmentAnalyzer,
                                    AnomalyAlertDispatcher dispatcher,
                                    MarketCalendarProvider calendarProvider,
                                    MetricsConfig metricsConfig,
                                    Clock clock) {
        this.detector = detector;
        this.rootCauseAnalyzer = rootCauseAnalyzer;
        this.segmentAnalyzer = segmentAnalyzer;
        this.dispatcher = dispatcher;
        this.calendarProvider = calendarProvider;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @param deadline shared by detection and dispatch, may be null
     */
    public EvaluationReport evaluate(AlertRecipient recipient, Instant deadline) {
        long start = System.nanoTime();
        LocalDate today = LocalDate.now(clock);

        DetectionResult detection = detector.detectAnomalies(recipient.getUserId(), recipient.getIndustry(), deadline);

        List<AnalyzedAnomaly> analyzed = new ArrayList<>();
        for (Anomaly anomaly : detection.getAnomalies()) {
            AnalysisContext context = AnalysisContext.builder()
                    .currentDate(today)
                    .industry(recipient.getIndustry())
                    .historicalPattern(anomaly.getHistoricalTrend())
                    .build();
            analyzed.add(AnalyzedAnomaly.of(anomaly, rootCauseAnalyzer.analyzeRootCause(anomaly, context)));
        }

        AlertDispatchResult dispatch = dispatcher.sendAlerts(AlertDispatchRequest.builder()
                .userId(recipient.getUserId())
                .userEmail(recipient.getEmail())
                .userName(recipient.getName())
                .anomalies(detection.getAnomalies())
                .build(), deadline);

        Map<AnomalySeverity, Long> bySeverity = new EnumMap<>(AnomalySeverity.class);
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
        for (Anomaly anomaly : detection.getAnomalies()) {
            bySeverity.merge(anomaly.getSeverity(), 1L, Long::sum);
            byType.merge(anomaly.getType(), 1L, Long::sum);
        }

        boolean complete = detection.isComplete() && dispatch.countSkipped(SkipReason.DEADLINE_REACHED) == 0;
        metricsConfig.recordEvaluationRun(complete ? "complete" : "partial");

        EvaluationReport report = EvaluationReport.builder()
                .userId(recipient.getUserId())
                .evaluatedAt(clock.instant())
                .anomalies(analyzed)
                .countsBySeverity(bySeverity)
                .countsByType(byType)
                .segments(segmentAnalyzer.analyzeSegments(detection.getAnomalies()))
                .marketEvents(calendarProvider.forDate(today).getDateEventInfo(today, recipient.getIndustry()).eventNames())
                .dispatch(dispatch)
                .complete(complete)
                .build();

        log.info("Evaluation for user={}: anomalies={}, sent={}, skipped={}, complete={}, {}ms",
                recipient.getUserId(), report.total(), dispatch.getSent().size(), dispatch.getSkipped().size(),
                complete, (System.nanoTime() - start) / 1_000_000);
        return report;
    }
}
