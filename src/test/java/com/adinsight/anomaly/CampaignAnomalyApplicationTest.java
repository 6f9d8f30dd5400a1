package com.adinsight.anomaly;

import com.adinsight.anomaly.model.AlertRecipient;
import com.adinsight.anomaly.model.Anomaly;
import com.adinsight.anomaly.model.EvaluationReport;
import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.model.SegmentAnalysis;
import com.adinsight.anomaly.port.EmailPort;
import com.adinsight.anomaly.repository.AlertHistoryStore;
import com.adinsight.anomaly.repository.InMemoryCampaignKpiRepository;
import com.adinsight.anomaly.service.AnomalyEvaluationService;
import com.adinsight.anomaly.service.LoggingEmailSender;
import com.adinsight.anomaly.service.ScheduledEvaluationJob;
import com.adinsight.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context with the in-memory adapters and runs one user's evaluation end to end.
 */
@SpringBootTest
@ActiveProfiles("test")
class CampaignAnomalyApplicationTest {

    @Autowired private AnomalyEvaluationService evaluationService;
    @Autowired private InMemoryCampaignKpiRepository kpiRepository;
    @Autowired private AlertHistoryStore alertHistory;
    @Autowired private EmailPort emailPort;
    @Autowired private ScheduledEvaluationJob scheduledJob;
    @Autowired private Clock clock;

    @AfterEach
    void tearDown() {
        alertHistory.clear();
    }

    @Test
    void contextLoads_withDefaultAdapters() {
        assertThat(emailPort).isInstanceOf(LoggingEmailSender.class);
        assertThat(scheduledJob).isNotNull();
    }

    @Test
    void evaluate_spendSpike_isDetectedAnalyzedAndSent() {
        LocalDate today = LocalDate.now(clock);
        kpiRepository.saveCampaign("user-ctx", TestDataFactory.createCampaign("ctx-1"));
        for (int i = 20; i >= 1; i--) {
            double spend = i % 2 == 0 ? 95 : 105;
            kpiRepository.saveSnapshot(TestDataFactory.createSnapshot("ctx-1", today.minusDays(i), spend, 10));
        }
        kpiRepository.saveSnapshot(TestDataFactory.createSnapshot("ctx-1", today, 400, 10));

        AlertRecipient recipient = TestDataFactory.createRecipient("user-ctx");
        EvaluationReport report = evaluationService.evaluate(recipient, Instant.now(clock).plusSeconds(60));

        assertThat(report.getAnomalies())
                .extracting(a -> a.getAnomaly().getMetric())
                .contains(MetricName.SPEND, MetricName.CPA);
        assertThat(report.getAnomalies()).allSatisfy(a -> {
            assertThat(a.getAnalysis()).isNotNull();
            assertThat(a.getAnalysis().getAnomalyId()).isEqualTo(a.getAnomaly().getId());
        });
        assertThat(report.getDispatch().getSent())
                .extracting(Anomaly::getMetric)
                .contains(MetricName.SPEND);
        assertThat(report.getDispatch().getErrors()).isEmpty();
        assertThat(report.getSegments().getSegments())
                .extracting(SegmentAnalysis.SegmentDetail::getName)
                .containsExactly("Campaign ctx-1");
        assertThat(report.isComplete()).isTrue();
    }
}
