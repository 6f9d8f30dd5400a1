package com.adinsight.anomaly.service;

import com.adinsight.anomaly.config.MetricsConfig;
import com.adinsight.anomaly.config.ScheduleConfig;
import com.adinsight.anomaly.model.AlertRecipient;
import com.adinsight.anomaly.port.AlertRecipientDirectory;
import com.adinsight.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledEvaluationJobTest {

    @Mock private AnomalyEvaluationService evaluationService;
    @Mock private AlertRecipientDirectory recipientDirectory;

    private ScheduleConfig config;
    private SimpleMeterRegistry registry;
    private ScheduledEvaluationJob job;

    @BeforeEach
    void setUp() {
        config = new ScheduleConfig();
        registry = new SimpleMeterRegistry();
        job = new ScheduledEvaluationJob(evaluationService, recipientDirectory, config,
                new MetricsConfig(registry), Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC));
    }

    @Test
    void runDailyEvaluation_disabled_doesNothing() {
        config.setEnabled(false);

        job.runDailyEvaluation();

        verifyNoInteractions(recipientDirectory, evaluationService);
    }

    @Test
    void runDailyEvaluation_evaluatesEachRecipientWithDeadline() {
        config.setUserTimeoutMinutes(5);
        AlertRecipient first = TestDataFactory.createRecipient("user-1");
        AlertRecipient second = TestDataFactory.createRecipient("user-2");
        when(recipientDirectory.recipients()).thenReturn(List.of(first, second));

        job.runDailyEvaluation();

        verify(evaluationService).evaluate(first, TestDataFactory.NOW.plusSeconds(300));
        verify(evaluationService).evaluate(second, TestDataFactory.NOW.plusSeconds(300));
    }

    @Test
    void runDailyEvaluation_oneUserFails_othersStillRun() {
        AlertRecipient failing = TestDataFactory.createRecipient("user-1");
        AlertRecipient healthy = TestDataFactory.createRecipient("user-2");
        when(recipientDirectory.recipients()).thenReturn(List.of(failing, healthy));
        when(evaluationService.evaluate(eq(failing), any())).thenThrow(new IllegalStateException("KPI store offline"));

        job.runDailyEvaluation();

        verify(evaluationService).evaluate(eq(healthy), any());
        assertThat(registry.find("evaluation.run.count").tag("status", "failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void runDailyEvaluation_noRecipients_evaluatesNobody() {
        when(recipientDirectory.recipients()).thenReturn(List.of());

        job.runDailyEvaluation();

        verify(evaluationService, never()).evaluate(any(), any());
    }
}
