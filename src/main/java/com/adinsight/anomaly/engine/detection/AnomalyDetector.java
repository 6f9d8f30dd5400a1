package com.adinsight.anomaly.engine.detection;

import com.adinsight.anomaly.config.DetectionConfig;
import com.adinsight.anomaly.config.MetricsConfig;
import com.adinsight.anomaly.engine.calendar.ChangeRange;
import com.adinsight.anomaly.engine.calendar.DateEventInfo;
import com.adinsight.anomaly.engine.calendar.MarketCalendar;
import com.adinsight.anomaly.engine.calendar.MarketCalendarProvider;
import com.adinsight.anomaly.engine.statistics.BaselineCalculator;
import com.adinsight.anomaly.engine.statistics.StatisticsToolkit;
import com.adinsight.anomaly.model.Anomaly;
import com.adinsight.anomaly.model.AnomalySeverity;
import com.adinsight.anomaly.model.Baseline;
import com.adinsight.anomaly.model.Campaign;
import com.adinsight.anomaly.model.DateRange;
import com.adinsight.anomaly.model.DetectionMethod;
import com.adinsight.anomaly.model.DetectionResult;
import com.adinsight.anomaly.model.Industry;
import com.adinsight.anomaly.model.KpiSnapshot;
import com.adinsight.anomaly.model.MarketContext;
import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.model.MetricPoint;
import com.adinsight.anomaly.model.TrendDirection;
import com.adinsight.anomaly.port.CampaignLister;
import com.adinsight.anomaly.port.KpiReader;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Detects anomalies in the latest daily value of each campaign metric.
 *
 * <p>For every (campaign, metric) the first applicable method decides, so at most one
 * anomaly is emitted per pair:</p>
 * <ol>
 *   <li>z-score against the baseline once {@code minDataPointsForZScore} historical points
 *       exist and the series varies;</li>
 *   <li>IQR distance once {@code minDataPoints} points exist and the IQR is non-zero;</li>
 *   <li>deviation from the latest moving average for the same sample size otherwise;</li>
 *   <li>day-over-day change against the previous observation when history is shorter
 *       than {@code minDataPoints}.</li>
 * </ol>
 *
 * <p>On market-calendar special days thresholds widen, and a candidate whose change lies
 * inside the expected range for the metric is suppressed.</p>
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final KpiReader kpiReader;
    private final CampaignLister campaignLister;
    private final BaselineCalculator baselineCalculator;
    private final MarketCalendarProvider calendarProvider;
    private final SeverityPolicy severityPolicy;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Executor executor;
    private final Clock clock;

    public AnomalyDetector(KpiReader kpiReader,
                           CampaignLister campaignLister,
                           BaselineCalculator baselineCalculator,
                           MarketCalendarProvider calendarProvider,
                           SeverityPolicy severityPolicy,
                           DetectionConfig config,
                           MetricsConfig metricsConfig,
                           Tracer tracer,
                           @Qualifier("detectionExecutor") Executor executor,
                           Clock clock) {
        this.kpiReader = kpiReader;
        this.campaignLister = campaignLister;
        this.baselineCalculator = baselineCalculator;
        this.calendarProvider = calendarProvider;
        this.severityPolicy = severityPolicy;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.executor = executor;
        this.clock = clock;
    }

    public List<Anomaly> detectAnomalies(String userId) {
        return detectAnomalies(userId, null, null).getAnomalies();
    }

    /**
     * Evaluates every active campaign of the user in parallel. Each campaign has its own
     * timeout, counted from when its task starts on the pool. A campaign that fails or times
     * out is logged and left out; the rest of the batch is still returned.
     *
     * @param industry fallback for campaigns without an industry, may be null
     * @param deadline stop waiting at this instant and return what is done, may be null
     */
    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public DetectionResult detectAnomalies(String userId, Industry industry, Instant deadline) {
        List<Campaign> campaigns = campaignLister.activeCampaigns(userId);

        Map<Campaign, CompletableFuture<List<Anomaly>>> futures = new LinkedHashMap<>();
        for (Campaign campaign : campaigns) {
            Industry effective = campaign.getIndustry() != null ? campaign.getIndustry() : industry;
            futures.put(campaign, submitCampaign(campaign, effective));
        }

        List<Anomaly> anomalies = new ArrayList<>();
        int failed = 0;
        boolean complete = true;

        for (Map.Entry<Campaign, CompletableFuture<List<Anomaly>>> entry : futures.entrySet()) {
            Campaign campaign = entry.getKey();
            CompletableFuture<List<Anomaly>> future = entry.getValue();
            try {
                if (deadline == null) {
                    anomalies.addAll(future.get());
                } else {
                    long waitMillis = Math.max(0, deadline.toEpochMilli() - clock.millis());
                    anomalies.addAll(future.get(waitMillis, TimeUnit.MILLISECONDS));
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                failed++;
                complete = false;
                log.warn("Detection for campaign {} of user {} was cut off by the deadline", campaign.getId(), userId);
            } catch (ExecutionException e) {
                failed++;
                if (e.getCause() instanceof TimeoutException) {
                    complete = false;
                    log.warn("Detection for campaign {} of user {} did not finish within {}s",
                            campaign.getId(), userId, config.getCampaignTimeoutSeconds());
                } else {
                    log.error("Detection failed for campaign {} of user {}: {}",
                            campaign.getId(), userId, e.getCause().getMessage(), e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                complete = false;
                futures.values().forEach(f -> f.cancel(true));
                log.warn("Detection for user {} interrupted after {} anomalies", userId, anomalies.size());
                break;
            }
        }

        // List.sort is stable, so order within a severity tier is preserved
        anomalies.sort(Comparator.comparing(Anomaly::getSeverity));

        log.info("Detection complete for user {}: campaigns={}, failed={}, anomalies={}, complete={}",
                userId, campaigns.size(), failed, anomalies.size(), complete);

        return DetectionResult.builder()
                .anomalies(List.copyOf(anomalies))
                .campaignsEvaluated(campaigns.size() - failed)
                .campaignsFailed(failed)
                .complete(complete)
                .build();
    }

    /**
     * The returned future times out {@code campaignTimeoutSeconds} after the task starts, not
     * after submission, so campaigns queued behind others keep their full budget. A task
     * cancelled before it starts is skipped.
     */
    private CompletableFuture<List<Anomaly>> submitCampaign(Campaign campaign, Industry industry) {
        CompletableFuture<List<Anomaly>> result = new CompletableFuture<>();
        executor.execute(() -> {
            if (result.isDone()) {
                return;
            }
            result.orTimeout(config.getCampaignTimeoutSeconds(), TimeUnit.SECONDS);
            try {
                if (!result.complete(detectCampaignAnomalies(campaign, industry))) {
                    log.debug("Discarding late detection result for campaign {}", campaign.getId());
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * @throws IllegalArgumentException when the campaign is unknown
     */
    public List<Anomaly> detectCampaignAnomalies(String campaignId) {
        Campaign campaign = campaignLister.findById(campaignId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown campaign: " + campaignId));
        return detectCampaignAnomalies(campaign, campaign.getIndustry());
    }

    @Observed(name = "anomaly.detect.campaign", contextualName = "detect-campaign-anomalies")
    public List<Anomaly> detectCampaignAnomalies(Campaign campaign, Industry industry) {
        LocalDate today = LocalDate.now(clock);
        DateEventInfo eventInfo = config.isCalendarEnabled()
                ? calendarProvider.forDate(today).getDateEventInfo(today, industry)
                : null;

        Span span = tracer.nextSpan()
                .name("anomaly.detect.campaign")
                .tag("campaign.id", campaign.getId())
                .start();

        List<Anomaly> anomalies = new ArrayList<>();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            for (MetricName metric : config.getMetrics()) {
                try {
                    Anomaly anomaly = evaluateMetric(campaign, metric, today, eventInfo, industry);
                    if (anomaly != null) {
                        anomalies.add(anomaly);
                        metricsConfig.recordAnomalyDetected(metric.name(), anomaly.getSeverity().name(),
                                anomaly.getDetectionMethod().name());
                    }
                } catch (Exception e) {
                    span.error(e);
                    // One unreadable metric must not hide the others
                    log.error("Error evaluating {} for campaign {}: {}",
                            metric, campaign.getId(), e.getMessage(), e);
                }
            }
            span.tag("anomaly.count", String.valueOf(anomalies.size()));
        } finally {
            span.end();
        }

        anomalies.sort(Comparator.comparing(Anomaly::getSeverity));
        return anomalies;
    }

    private Anomaly evaluateMetric(Campaign campaign, MetricName metric, LocalDate today,
                                   DateEventInfo eventInfo, Industry industry) {
        double[] values = readSeries(campaign.getId(), metric, today);
        if (values.length < 2) {
            log.debug("Skipping {} for campaign {}: {} data points", metric, campaign.getId(), values.length);
            return null;
        }

        double current = values[values.length - 1];
        double previous = values[values.length - 2];
        double[] historical = Arrays.copyOfRange(values, 0, values.length - 1);
        Baseline baseline = baselineCalculator.calculate(historical);
        boolean specialDay = eventInfo != null && eventInfo.isSpecialDay();

        Candidate candidate = robustCandidate(metric, current, historical, baseline, eventInfo);
        if (candidate == null && baseline.getSampleSize() < config.getMinDataPoints() && previous > 0) {
            candidate = thresholdCandidate(metric, current, previous, today, industry, specialDay);
        }
        if (candidate == null) {
            return null;
        }

        // A placeholder change says nothing about the expected range, so it never suppresses
        if (specialDay && !candidate.placeholderChange && eventInfo.getCombinedExpectedChange()
                .get(metric.getChangeKey()).contains(candidate.changePercent)) {
            metricsConfig.recordAnomalySuppressed(metric.name());
            log.warn("Suppressed {} {} of {}% for campaign {}: within expected range for {}",
                    metric, candidate.method, String.format(Locale.ROOT, "%.1f", candidate.changePercent),
                    campaign.getId(), eventInfo.eventNames());
            return null;
        }

        TrendDirection trend = trendOf(historical);
        boolean increase = candidate.increase;
        AnomalySeverity severity = severityPolicy.severityFor(metric, increase, candidate.magnitude, candidate.changePercent);
        Instant detectedAt = clock.instant();

        log.debug("Anomaly on {} for campaign {}: method={}, change={}, magnitude={}, severity={}",
                metric, campaign.getId(), candidate.method, candidate.changePercent, candidate.magnitude, severity);

        return Anomaly.builder()
                .id(anomalyId(campaign.getId(), metric, candidate.method, detectedAt))
                .campaignId(campaign.getId())
                .campaignName(campaign.getName())
                .type(severityPolicy.typeFor(metric, increase, trend))
                .severity(severity)
                .metric(metric)
                .currentValue(current)
                .previousValue(previous)
                .referenceValue(candidate.reference)
                .changePercent(candidate.changePercent)
                .message(AnomalyMessages.message(metric, candidate.changePercent, trend))
                .detectedAt(detectedAt)
                .detectionMethod(candidate.method)
                .zScore(candidate.zScore)
                .iqrDistance(candidate.iqrDistance)
                .historicalTrend(trend)
                .baseline(baseline.isEmpty() ? null : baseline)
                .marketContext(marketContext(metric, eventInfo))
                .recommendations(AnomalyMessages.recommendations(metric, increase, trend))
                .build();
    }

    private double[] readSeries(String campaignId, MetricName metric, LocalDate today) {
        List<MetricPoint> series = kpiReader.seriesFor(campaignId, metric,
                DateRange.lastDays(today, config.getHistoryDays()));
        if (series != null && series.size() >= 2) {
            return series.stream().mapToDouble(MetricPoint::getValue).toArray();
        }
        List<KpiSnapshot> latest = kpiReader.latestTwo(campaignId);
        if (latest == null) {
            return new double[0];
        }
        return latest.stream().mapToDouble(s -> s.valueOf(metric)).toArray();
    }

    private Candidate robustCandidate(MetricName metric, double current, double[] historical,
                                      Baseline baseline, DateEventInfo eventInfo) {
        boolean specialDay = eventInfo != null && eventInfo.isSpecialDay();

        if (baseline.getSampleSize() >= config.getMinDataPointsForZScore() && baseline.getStdDev() > 0) {
            double z = StatisticsToolkit.zScore(current, baseline.getMean(), baseline.getStdDev());
            double threshold = config.getZScoreThreshold()
                    * (specialDay ? config.getSpecialDayZScoreMultiplier() : 1.0);
            if (Math.abs(z) <= threshold) {
                return null;
            }
            Candidate c = Candidate.against(DetectionMethod.ZSCORE, current, baseline.getMean(), Math.abs(z));
            c.zScore = z;
            return c;
        }

        if (baseline.getSampleSize() < config.getMinDataPoints()) {
            return null;
        }

        if (baseline.getIqr() > 0) {
            double distance = StatisticsToolkit.iqrDistance(current, baseline.getQ1(), baseline.getQ3(), baseline.getIqr());
            if (distance <= config.getIqrThreshold()) {
                return null;
            }
            Candidate c = Candidate.against(DetectionMethod.IQR, current, iqrReference(baseline, historical), distance);
            c.iqrDistance = distance;
            return c;
        }

        double[] averages = StatisticsToolkit.movingAverage(historical, config.getMovingAverageWindow());
        if (averages.length == 0) {
            return null;
        }
        double latestAverage = averages[averages.length - 1];
        if (latestAverage == 0) {
            return null;
        }
        double deviationPct = (current - latestAverage) / Math.abs(latestAverage) * 100.0;
        double threshold = config.getMovingAverageDeviationPct();
        if (specialDay) {
            threshold += eventInfo.getCombinedExpectedChange().get(metric.getChangeKey()).widestBound() / 2.0;
        }
        if (Math.abs(deviationPct) <= threshold) {
            return null;
        }
        return Candidate.against(DetectionMethod.MOVING_AVERAGE, current, latestAverage,
                Math.abs(deviationPct) / config.getMovingAverageDeviationPct());
    }

    /**
     * The median, or the upper quartile when the median is zero (a mostly paused series),
     * or the previous observation when both are zero.
     */
    private static double iqrReference(Baseline baseline, double[] historical) {
        if (baseline.getMedian() != 0) {
            return baseline.getMedian();
        }
        if (baseline.getQ3() != 0) {
            return baseline.getQ3();
        }
        return historical[historical.length - 1];
    }

    private Candidate thresholdCandidate(MetricName metric, double current, double previous,
                                         LocalDate today, Industry industry, boolean specialDay) {
        double changePercent = (current - previous) / previous * 100.0;
        double spikeThreshold = config.getSpikeThresholdPct();
        double dropThreshold = config.getDropThresholdPct();
        if (specialDay) {
            MarketCalendar calendar = calendarProvider.forDate(today);
            spikeThreshold = calendar.getAdjustedThreshold(today, spikeThreshold, metric.getChangeKey(), true, industry);
            dropThreshold = -calendar.getAdjustedThreshold(today, Math.abs(dropThreshold), metric.getChangeKey(), false, industry);
        }

        if (changePercent >= spikeThreshold) {
            return Candidate.against(DetectionMethod.THRESHOLD, current, previous, changePercent / spikeThreshold);
        }
        if (changePercent <= dropThreshold) {
            return Candidate.against(DetectionMethod.THRESHOLD, current, previous, changePercent / dropThreshold);
        }
        return null;
    }

    private TrendDirection trendOf(double[] historical) {
        int window = Math.min(historical.length, config.getTrend().getWindow());
        double[] recent = Arrays.copyOfRange(historical, historical.length - window, historical.length);
        return StatisticsToolkit.detectTrend(recent,
                config.getTrend().getGrowthThresholdPct(), config.getTrend().getVolatilityCvPct());
    }

    private MarketContext marketContext(MetricName metric, DateEventInfo eventInfo) {
        if (eventInfo == null) {
            return null;
        }
        if (!eventInfo.isSpecialDay()) {
            return MarketContext.ordinaryDay();
        }
        ChangeRange range = eventInfo.getCombinedExpectedChange().get(metric.getChangeKey());
        return MarketContext.builder()
                .specialDay(true)
                .events(eventInfo.eventNames())
                .expectedMinChange(range.getMin())
                .expectedMaxChange(range.getMax())
                .withinExpectedRange(false)
                .approximate(eventInfo.isApproximate())
                .build();
    }

    private static String anomalyId(String campaignId, MetricName metric, DetectionMethod method, Instant at) {
        return "anomaly_" + campaignId + "_" + metric.name().toLowerCase(Locale.ROOT)
                + "_" + method.name().toLowerCase(Locale.ROOT) + "_" + at.toEpochMilli();
    }

    /**
     * A breach before suppression and severity are applied.
     */
    private static final class Candidate {
        private final DetectionMethod method;
        private final double reference;
        private final double changePercent;
        private final boolean increase;
        private final double magnitude;
        // True when the reference was zero and changePercent is the +/-100 convention
        private final boolean placeholderChange;
        private Double zScore;
        private Double iqrDistance;

        private Candidate(DetectionMethod method, double reference, double changePercent,
                          boolean increase, double magnitude, boolean placeholderChange) {
            this.method = method;
            this.reference = reference;
            this.changePercent = changePercent;
            this.increase = increase;
            this.magnitude = magnitude;
            this.placeholderChange = placeholderChange;
        }

        static Candidate against(DetectionMethod method, double current, double reference, double magnitude) {
            if (reference == 0) {
                double changePercent = Math.signum(current) * 100.0;
                return new Candidate(method, reference, changePercent, current > reference, magnitude, true);
            }
            double changePercent = (current - reference) / Math.abs(reference) * 100.0;
            return new Candidate(method, reference, changePercent, current > reference, magnitude, false);
        }
    }
}
