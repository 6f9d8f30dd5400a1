package com.adinsight.anomaly.service;

import com.adinsight.anomaly.config.AlertConfig;
import com.adinsight.anomaly.config.MetricsConfig;
import com.adinsight.anomaly.model.AlertDispatchRequest;
import com.adinsight.anomaly.model.AlertDispatchResult;
import com.adinsight.anomaly.model.AlertRecord;
import com.adinsight.anomaly.model.Anomaly;
import com.adinsight.anomaly.model.SkipReason;
import com.adinsight.anomaly.model.SkippedAlert;
import com.adinsight.anomaly.port.EmailMessage;
import com.adinsight.anomaly.port.EmailPort;
import com.adinsight.anomaly.port.EmailSendResult;
import com.adinsight.anomaly.repository.AlertHistoryStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sends one email per qualifying anomaly, subject to a severity floor, a per-campaign daily
 * cap and a (campaign, metric) deduplication window. A failed send is reported and the
 * batch continues.
 */
@Service
public class AnomalyAlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAlertDispatcher.class);

    private static final Duration RATE_LIMIT_WINDOW = Duration.ofHours(24);

    private final EmailPort emailPort;
    private final AlertEmailRenderer renderer;
    private final AlertHistoryStore history;
    private final AlertConfig config;
    private final MetricsConfig metricsConfig;
    private final Executor sendExecutor;
    private final Clock clock;

    // Serialises dispatch runs of the same user; an entry lives only while a run holds or awaits it
    private final ConcurrentHashMap<String, UserLock> userLocks = new ConcurrentHashMap<>();

    public AnomalyAlertDispatcher(EmailPort emailPort,
                                  AlertEmailRenderer renderer,
                                  AlertHistoryStore history,
                                  AlertConfig config,
                                  MetricsConfig metricsConfig,
                                  @Qualifier("alertSendExecutor") Executor sendExecutor,
                                  Clock clock) {
        this.emailPort = emailPort;
        this.renderer = renderer;
        this.history = history;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.sendExecutor = sendExecutor;
        this.clock = clock;
    }

    public AlertDispatchResult sendAlerts(AlertDispatchRequest request) {
        return sendAlerts(request, null);
    }

    /**
     * @param deadline no send is started at or after this instant, may be null
     * @throws IllegalArgumentException when the request is malformed
     */
    @Observed(name = "alert.dispatch", contextualName = "send-alerts")
    public AlertDispatchResult sendAlerts(AlertDispatchRequest request, Instant deadline) {
        request.validate();
        if (request.getAnomalies().isEmpty()) {
            return AlertDispatchResult.empty();
        }

        String userId = request.getUserId();
        UserLock userLock = userLocks.compute(userId, (id, existing) -> {
            UserLock held = existing != null ? existing : new UserLock();
            held.holders++;
            return held;
        });
        userLock.lock.lock();
        try {
            return dispatch(request, deadline);
        } finally {
            userLock.lock.unlock();
            userLocks.computeIfPresent(userId, (id, held) -> --held.holders == 0 ? null : held);
        }
    }

    int activeUserLocks() {
        return userLocks.size();
    }

    private AlertDispatchResult dispatch(AlertDispatchRequest request, Instant deadline) {
        List<Anomaly> sent = new ArrayList<>();
        List<SkippedAlert> skipped = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        Duration dedupWindow = Duration.ofHours(config.getDeduplicationWindowHours());
        Duration retention = dedupWindow.compareTo(RATE_LIMIT_WINDOW) > 0 ? dedupWindow : RATE_LIMIT_WINDOW;
        history.pruneAll(clock.instant().minus(retention));

        for (Anomaly anomaly : request.getAnomalies()) {
            if (!anomaly.getSeverity().isAtLeast(config.getMinimumSeverity())) {
                skip(skipped, anomaly, SkipReason.BELOW_SEVERITY,
                        anomaly.getSeverity() + " is below " + config.getMinimumSeverity());
                continue;
            }

            Instant now = clock.instant();
            List<AlertRecord> records = history.pruneAndGet(anomaly.getCampaignId(), now.minus(retention));

            Instant dayAgo = now.minus(RATE_LIMIT_WINDOW);
            long lastDay = records.stream().filter(r -> r.getTimestamp().isAfter(dayAgo)).count();
            if (lastDay >= config.getMaxAlertsPerCampaignPerDay()) {
                skip(skipped, anomaly, SkipReason.RATE_LIMITED,
                        lastDay + " alerts for campaign " + anomaly.getCampaignId() + " in the last 24h");
                continue;
            }

            Instant dedupCutoff = now.minus(dedupWindow);
            boolean duplicate = records.stream().anyMatch(r ->
                    r.getMetric() == anomaly.getMetric() && r.getTimestamp().isAfter(dedupCutoff));
            if (duplicate) {
                skip(skipped, anomaly, SkipReason.DUPLICATE,
                        anomaly.getMetric() + " already alerted within " + config.getDeduplicationWindowHours() + "h");
                continue;
            }

            if (!config.isEmailEnabled()) {
                skip(skipped, anomaly, SkipReason.EMAIL_DISABLED, "email alerts are disabled");
                continue;
            }

            if (deadline != null && !now.isBefore(deadline)) {
                skip(skipped, anomaly, SkipReason.DEADLINE_REACHED, "deadline " + deadline + " passed");
                continue;
            }

            String failure = deliver(request, anomaly);
            if (failure == null) {
                sent.add(anomaly);
                history.append(AlertRecord.of(anomaly.getCampaignId(), anomaly.getMetric(),
                        anomaly.getSeverity(), clock.instant()));
                metricsConfig.recordAlertDispatch("sent");
                log.info("Alert sent: user={}, anomaly={}, severity={}",
                        request.getUserId(), anomaly.getId(), anomaly.getSeverity());
            } else {
                skip(skipped, anomaly, SkipReason.DELIVERY_FAILED, failure);
                errors.add("Failed to send alert for " + anomaly.getId() + ": " + failure);
            }
        }

        log.info("Alert dispatch for user={}: sent={}, skipped={}, errors={}",
                request.getUserId(), sent.size(), skipped.size(), errors.size());

        return AlertDispatchResult.builder()
                .sent(sent)
                .skipped(skipped)
                .errors(errors)
                .build();
    }

    /**
     * A send that outlives the timeout is reported as failed. If it later succeeds, the
     * delivery is still recorded so the next run does not send it again.
     *
     * @return null on success, otherwise why delivery failed
     */
    private String deliver(AlertDispatchRequest request, Anomaly anomaly) {
        CompletableFuture<EmailSendResult> future = null;
        try {
            EmailMessage message = renderer.render(request.getUserEmail(), request.getUserName(), anomaly);
            future = CompletableFuture.supplyAsync(() -> emailPort.send(message), sendExecutor);
            EmailSendResult result = future.get(config.getSendTimeoutSeconds(), TimeUnit.SECONDS);
            if (result != null && result.isSuccess()) {
                return null;
            }
            String error = result == null || result.getError() == null ? "unknown error" : result.getError();
            log.warn("Email provider rejected alert {}: {}", anomaly.getId(), error);
            return error;
        } catch (TimeoutException e) {
            log.error("Email send timed out after {}s for alert {}", config.getSendTimeoutSeconds(), anomaly.getId());
            recordLateDelivery(future, anomaly);
            return String.format(Locale.ROOT, "timed out after %ds", config.getSendTimeoutSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while sending alert {}", anomaly.getId());
            recordLateDelivery(future, anomaly);
            return "interrupted";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Email send failed for alert {}: {}", anomaly.getId(), cause.getMessage(), cause);
            return String.valueOf(cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to prepare alert {}: {}", anomaly.getId(), e.getMessage(), e);
            return String.valueOf(e.getMessage());
        }
    }

    private void recordLateDelivery(CompletableFuture<EmailSendResult> future, Anomaly anomaly) {
        if (future == null) {
            return;
        }
        future.whenComplete((late, error) -> {
            if (error == null && late != null && late.isSuccess()) {
                history.append(AlertRecord.of(anomaly.getCampaignId(), anomaly.getMetric(),
                        anomaly.getSeverity(), clock.instant()));
                metricsConfig.recordAlertDispatch("sent_late");
                log.warn("Alert {} was delivered after the timeout; recorded in history", anomaly.getId());
            }
        });
    }

    private void skip(List<SkippedAlert> skipped, Anomaly anomaly, SkipReason reason, String detail) {
        skipped.add(SkippedAlert.of(anomaly, reason, detail));
        metricsConfig.recordAlertDispatch(reason.name().toLowerCase(Locale.ROOT));
        log.debug("Alert skipped: anomaly={}, reason={}, detail={}", anomaly.getId(), reason, detail);
    }

    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's per-key compute
        private int holders;
    }
}
