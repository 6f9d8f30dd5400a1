package com.adinsight.anomaly.service;

import com.adinsight.anomaly.config.MetricsConfig;
import com.adinsight.anomaly.config.ScheduleConfig;
import com.adinsight.anomaly.model.AlertRecipient;
import com.adinsight.anomaly.port.AlertRecipientDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
public class ScheduledEvaluationJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledEvaluationJob.class);

    private final AnomalyEvaluationService evaluationService;
    private final AlertRecipientDirectory recipientDirectory;
    private final ScheduleConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ScheduledEvaluationJob(AnomalyEvaluationService evaluationService,
                                  AlertRecipientDirectory recipientDirectory,
                                  ScheduleConfig config,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.evaluationService = evaluationService;
        this.recipientDirectory = recipientDirectory;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(cron = "${anomaly.schedule.cron:0 0 8 * * *}", zone = "${anomaly.schedule.zone:Asia/Seoul}")
    public void runDailyEvaluation() {
        if (!config.isEnabled()) {
            return;
        }

        int evaluated = 0;
        int failed = 0;
        for (AlertRecipient recipient : recipientDirectory.recipients()) {
            Instant deadline = clock.instant().plusSeconds(config.getUserTimeoutMinutes() * 60L);
            try {
                evaluationService.evaluate(recipient, deadline);
                evaluated++;
            } catch (Exception e) {
                failed++;
                metricsConfig.recordEvaluationRun("failed");
                log.error("Scheduled evaluation failed for user={}: {}", recipient.getUserId(), e.getMessage(), e);
            }
        }

        log.info("Scheduled evaluation complete: evaluated={}, failed={}", evaluated, failed);
    }
}
