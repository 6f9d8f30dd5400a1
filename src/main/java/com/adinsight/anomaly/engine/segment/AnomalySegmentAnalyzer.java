package com.adinsight.anomaly.engine.segment;

import com.adinsight.anomaly.model.*;
import com.adinsight.anomaly.model.SegmentAnalysis.CorrelationType;
import com.adinsight.anomaly.model.SegmentAnalysis.Insight;
import com.adinsight.anomaly.model.SegmentAnalysis.InsightType;
import com.adinsight.anomaly.model.SegmentAnalysis.MetricCorrelation;
import com.adinsight.anomaly.model.SegmentAnalysis.Propagation;
import com.adinsight.anomaly.model.SegmentAnalysis.SegmentDetail;
import com.adinsight.anomaly.model.SegmentAnalysis.TimeDistribution;
import com.adinsight.anomaly.model.TimePatternAnalysis.TimePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.*;
import java.util.function.Function;

/**
 * Groups a run's anomalies by campaign, metric category and day of week, and looks for
 * metrics that move together and for anomalies that follow on from an earlier one.
 * Days are taken in the clock's zone.
 */
@Component
public class AnomalySegmentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AnomalySegmentAnalyzer.class);

    private static final double HIGH_RISK_SEVERITY = 2.5;
    private static final double HEALTHY_SEVERITY = 1.5;
    private static final int HEALTHY_MAX_ANOMALIES = 5;
    private static final double METRIC_CONCENTRATION_SHARE = 0.4;
    private static final double TIME_PATTERN_MIN_CONFIDENCE = 0.6;
    private static final double CORRELATION_MIN_RATIO = 0.7;
    private static final int CORRELATION_MIN_PAIRS = 2;
    private static final double OUTLIER_DAY_DEVIATION = 0.5;

    private final ZoneId zone;

    public AnomalySegmentAnalyzer(Clock clock) {
        this.zone = clock.getZone();
    }

    public SegmentAnalysis analyzeSegments(List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return SegmentAnalysis.empty();
        }
        List<SegmentDetail> segments = new ArrayList<>();
        for (List<Anomaly> campaignAnomalies : groupBy(anomalies, Anomaly::getCampaignId).values()) {
            segments.add(buildSegment(campaignAnomalies.get(0).getCampaignName(), campaignAnomalies));
        }
        segments.sort((a, b) -> Double.compare(b.getAvgSeverityScore(), a.getAvgSeverityScore()));

        SegmentAnalysis analysis = SegmentAnalysis.builder()
                .segments(segments)
                .insights(generateInsights(anomalies, segments))
                .correlations(analyzeMetricCorrelations(anomalies))
                .propagation(analyzePropagation(anomalies))
                .build();
        log.debug("Segmented {} anomalies into {} campaigns, {} insights, {} correlations",
                anomalies.size(), segments.size(), analysis.getInsights().size(), analysis.getCorrelations().size());
        return analysis;
    }

    /**
     * Per-campaign health, least healthy first.
     */
    public List<CampaignComparison> compareCampaigns(List<Anomaly> anomalies) {
        List<CampaignComparison> comparisons = new ArrayList<>();
        for (Map.Entry<String, List<Anomaly>> entry : groupBy(anomalies, Anomaly::getCampaignId).entrySet()) {
            List<Anomaly> campaignAnomalies = entry.getValue();

            Map<MetricName, double[]> totals = new EnumMap<>(MetricName.class); // metric -> [count, sum |change|]
            for (Anomaly anomaly : campaignAnomalies) {
                double[] t = totals.computeIfAbsent(anomaly.getMetric(), k -> new double[2]);
                t[0]++;
                t[1] += Math.abs(anomaly.getChangePercent());
            }
            Map<MetricName, CampaignComparison.MetricSummary> metrics = new EnumMap<>(MetricName.class);
            totals.forEach((metric, t) -> metrics.put(metric, CampaignComparison.MetricSummary.of((int) t[0], t[1] / t[0])));

            double avgSeverity = averageSeverity(campaignAnomalies);
            double health = Math.max(0, 100 - campaignAnomalies.size() * 10 - avgSeverity * 15);

            comparisons.add(CampaignComparison.builder()
                    .campaignId(entry.getKey())
                    .campaignName(campaignAnomalies.get(0).getCampaignName())
                    .anomalyCount(campaignAnomalies.size())
                    .avgSeverity(avgSeverity)
                    .dominantAnomalyType(mostFrequent(campaignAnomalies, Anomaly::getType))
                    .metrics(metrics)
                    .healthScore((int) Math.round(health))
                    .build());
        }
        comparisons.sort(Comparator.comparingInt(CampaignComparison::getHealthScore));
        return comparisons;
    }

    public TimePatternAnalysis analyzeTimePatterns(List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return timePattern(TimePattern.RANDOM, 0.5, "No anomalies to find a pattern in.");
        }
        TimeDistribution distribution = distribute(anomalies);
        double weekdayRatio = (double) distribution.getWeekday() / anomalies.size();

        if (weekdayRatio > 0.8) {
            return timePattern(TimePattern.WEEKDAY_SPIKE, weekdayRatio,
                    "Anomalies cluster on weekdays, which points to business-hours activity.");
        }
        if (weekdayRatio < 0.3) {
            return timePattern(TimePattern.WEEKEND_SPIKE, 1 - weekdayRatio,
                    "Anomalies cluster on weekends. Check for shifts in consumer behaviour.");
        }

        Map.Entry<DayOfWeek, Long> busiest = distribution.getByDayOfWeek().entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
        double busiestRatio = (double) busiest.getValue() / anomalies.size();
        if (busiestRatio > 0.4) {
            return timePattern(TimePattern.PERIODIC, busiestRatio,
                    "Anomalies cluster on " + busiest.getKey().getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                            + ". Check for recurring events or scheduled jobs.");
        }
        return timePattern(TimePattern.CONSISTENT, 0.6, "Anomalies are spread evenly across the week.");
    }

    /**
     * One segment per metric category that has anomalies. Segments carry no time distribution.
     */
    public Map<MetricCategory, SegmentDetail> analyzeByMetric(List<Anomaly> anomalies) {
        Map<MetricCategory, List<Anomaly>> byCategory = new EnumMap<>(MetricCategory.class);
        for (Anomaly anomaly : anomalies) {
            byCategory.computeIfAbsent(MetricCategory.of(anomaly.getMetric()), k -> new ArrayList<>()).add(anomaly);
        }

        Map<MetricCategory, SegmentDetail> result = new EnumMap<>(MetricCategory.class);
        byCategory.forEach((category, categoryAnomalies) -> result.put(category, SegmentDetail.builder()
                .name(category.getLabel())
                .anomalyCount(categoryAnomalies.size())
                .anomalies(categoryAnomalies)
                .avgSeverityScore(averageSeverity(categoryAnomalies))
                .dominantType(mostFrequent(categoryAnomalies, Anomaly::getType))
                .mostAffectedMetric(mostFrequent(categoryAnomalies, Anomaly::getMetric))
                .build()));
        return result;
    }

    public KpiTimePattern analyzeKpiTimePatterns(List<KpiSnapshot> snapshots) {
        List<KpiSnapshot> weekday = new ArrayList<>();
        List<KpiSnapshot> weekend = new ArrayList<>();
        Map<DayOfWeek, List<KpiSnapshot>> byDay = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            byDay.put(day, new ArrayList<>());
        }
        for (KpiSnapshot snapshot : snapshots) {
            DayOfWeek day = snapshot.getDate().getDayOfWeek();
            byDay.get(day).add(snapshot);
            (isWeekend(day) ? weekend : weekday).add(snapshot);
        }

        Map<DayOfWeek, KpiTimePattern.KpiAverages> dayAverages = new EnumMap<>(DayOfWeek.class);
        byDay.forEach((day, daySnapshots) -> dayAverages.put(day, averages(daySnapshots)));

        // Days whose spend or clicks are more than half away from the overall average
        KpiTimePattern.KpiAverages overall = averages(snapshots);
        List<LocalDate> outliers = new ArrayList<>();
        for (KpiSnapshot snapshot : snapshots) {
            if (deviates(snapshot.getSpend(), overall.getSpend())
                    || deviates(snapshot.getClicks(), overall.getClicks())) {
                outliers.add(snapshot.getDate());
            }
        }

        return KpiTimePattern.builder()
                .weekdayAverage(averages(weekday))
                .weekendAverage(averages(weekend))
                .dayOfWeekAverage(dayAverages)
                .outlierDays(outliers)
                .build();
    }

    private SegmentDetail buildSegment(String name, List<Anomaly> anomalies) {
        return SegmentDetail.builder()
                .name(name)
                .anomalyCount(anomalies.size())
                .anomalies(anomalies)
                .avgSeverityScore(averageSeverity(anomalies))
                .dominantType(mostFrequent(anomalies, Anomaly::getType))
                .mostAffectedMetric(mostFrequent(anomalies, Anomaly::getMetric))
                .timeDistribution(distribute(anomalies))
                .build();
    }

    private List<Insight> generateInsights(List<Anomaly> anomalies, List<SegmentDetail> segments) {
        List<Insight> insights = new ArrayList<>();

        List<String> highRisk = segments.stream()
                .filter(s -> s.getAvgSeverityScore() >= HIGH_RISK_SEVERITY)
                .map(SegmentDetail::getName)
                .toList();
        if (!highRisk.isEmpty()) {
            insights.add(Insight.builder()
                    .id("high-risk-campaigns")
                    .type(InsightType.WARNING)
                    .title("High-risk campaigns found")
                    .description(highRisk.size() + " campaign(s) show severe anomalies and need review now.")
                    .confidence(0.9)
                    .relatedSegments(highRisk)
                    .actionItems(List.of(
                            "Check recent setting changes on these campaigns",
                            "Review budget and targeting",
                            "Watch competitor activity"))
                    .build());
        }

        MetricName topMetric = mostFrequent(anomalies, Anomaly::getMetric);
        long topCount = anomalies.stream().filter(a -> a.getMetric() == topMetric).count();
        double share = (double) topCount / anomalies.size();
        if (share > METRIC_CONCENTRATION_SHARE) {
            insights.add(Insight.builder()
                    .id("metric-concentration")
                    .type(InsightType.PATTERN)
                    .title(topMetric.getLabel() + " anomalies concentrated")
                    .description(Math.round(share * 100) + "% of all anomalies are on " + topMetric.getLabel() + ".")
                    .confidence(share)
                    .relatedSegments(List.of())
                    .actionItems(List.of(
                            "Review every setting that drives " + topMetric.getLabel(),
                            "Check related metrics for knock-on effects"))
                    .build());
        }

        TimePatternAnalysis time = analyzeTimePatterns(anomalies);
        if (time.getPattern() != TimePattern.RANDOM && time.getConfidence() > TIME_PATTERN_MIN_CONFIDENCE) {
            insights.add(Insight.builder()
                    .id("time-pattern")
                    .type(InsightType.PATTERN)
                    .title("Time pattern detected")
                    .description(time.getDetails())
                    .confidence(time.getConfidence())
                    .relatedSegments(List.of())
                    .actionItems(time.getRecommendedMonitoring())
                    .build());
        }

        if (averageSeverity(anomalies) < HEALTHY_SEVERITY && anomalies.size() < HEALTHY_MAX_ANOMALIES) {
            insights.add(Insight.builder()
                    .id("healthy-status")
                    .type(InsightType.RECOMMENDATION)
                    .title("Overall healthy")
                    .description("Most campaigns are running normally. Keep the current setup and keep monitoring.")
                    .confidence(0.8)
                    .relatedSegments(List.of())
                    .actionItems(List.of())
                    .build());
        }
        return insights;
    }

    private List<MetricCorrelation> analyzeMetricCorrelations(List<Anomaly> anomalies) {
        // Anomalies of one campaign on one day
        Map<String, List<Anomaly>> byCampaignDay = groupBy(anomalies,
                a -> a.getCampaignId() + "|" + LocalDate.ofInstant(a.getDetectedAt(), zone));

        Map<List<MetricName>, int[]> pairCounts = new LinkedHashMap<>(); // pair -> [same direction, total]
        for (List<Anomaly> group : byCampaignDay.values()) {
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    Anomaly a1 = group.get(i);
                    Anomaly a2 = group.get(j);
                    List<MetricName> pair = a1.getMetric().compareTo(a2.getMetric()) <= 0
                            ? List.of(a1.getMetric(), a2.getMetric())
                            : List.of(a2.getMetric(), a1.getMetric());
                    int[] counts = pairCounts.computeIfAbsent(pair, k -> new int[2]);
                    counts[1]++;
                    if (sameDirection(a1.getChangePercent(), a2.getChangePercent())) counts[0]++;
                }
            }
        }

        List<MetricCorrelation> correlations = new ArrayList<>();
        pairCounts.forEach((pair, counts) -> {
            if (counts[1] < CORRELATION_MIN_PAIRS) return;
            double positive = (double) counts[0] / counts[1];
            double negative = 1 - positive;
            CorrelationType type;
            double strength;
            if (positive > CORRELATION_MIN_RATIO) {
                type = CorrelationType.POSITIVE;
                strength = positive;
            } else if (negative > CORRELATION_MIN_RATIO) {
                type = CorrelationType.NEGATIVE;
                strength = negative;
            } else {
                return;
            }
            correlations.add(MetricCorrelation.builder()
                    .metric1(pair.get(0))
                    .metric2(pair.get(1))
                    .type(type)
                    .strength(strength)
                    .description(describeCorrelation(pair.get(0), pair.get(1), type))
                    .build());
        });
        correlations.sort((a, b) -> Double.compare(b.getStrength(), a.getStrength()));
        return correlations;
    }

    private Propagation analyzePropagation(List<Anomaly> anomalies) {
        if (anomalies.size() < 2) {
            return null;
        }
        List<Anomaly> sorted = new ArrayList<>(anomalies);
        sorted.sort(Comparator.comparing(Anomaly::getDetectedAt));

        Anomaly root = sorted.stream()
                .filter(a -> a.getSeverity() == AnomalySeverity.CRITICAL || a.getSeverity() == AnomalySeverity.WARNING)
                .findFirst()
                .orElse(null);
        if (root == null) {
            return null;
        }

        List<Anomaly> propagated = sorted.stream()
                .filter(a -> a.getCampaignId().equals(root.getCampaignId()))
                .filter(a -> !a.getId().equals(root.getId()))
                .filter(a -> !a.getDetectedAt().isBefore(root.getDetectedAt()))
                .toList();
        if (propagated.isEmpty()) {
            return null;
        }

        List<MetricName> chain = new ArrayList<>();
        chain.add(root.getMetric());
        propagated.forEach(a -> chain.add(a.getMetric()));

        List<Anomaly> involved = new ArrayList<>(propagated);
        involved.add(root);
        return Propagation.builder()
                .rootAnomaly(root)
                .propagatedAnomalies(propagated)
                .chain(chain)
                .impactScore(averageSeverity(involved))
                .build();
    }

    private TimeDistribution distribute(List<Anomaly> anomalies) {
        Map<DayOfWeek, Long> byDay = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            byDay.put(day, 0L);
        }
        long weekday = 0;
        long weekend = 0;
        for (Anomaly anomaly : anomalies) {
            DayOfWeek day = LocalDate.ofInstant(anomaly.getDetectedAt(), zone).getDayOfWeek();
            byDay.merge(day, 1L, Long::sum);
            if (isWeekend(day)) weekend++;
            else weekday++;
        }
        return TimeDistribution.builder()
                .weekday(weekday)
                .weekend(weekend)
                .byDayOfWeek(byDay)
                .build();
    }

    private static TimePatternAnalysis timePattern(TimePattern pattern, double confidence, String details) {
        return TimePatternAnalysis.builder()
                .pattern(pattern)
                .confidence(confidence)
                .details(details)
                .recommendedMonitoring(recommendedMonitoring(pattern))
                .build();
    }

    private static List<String> recommendedMonitoring(TimePattern pattern) {
        return switch (pattern) {
            case WEEKDAY_SPIKE -> List.of(
                    "Watch weekday morning performance closely",
                    "Align ad delivery hours with business hours",
                    "Consider moving weekend budget");
            case WEEKEND_SPIKE -> List.of(
                    "Analyse weekend shopper behaviour",
                    "Test weekend-specific creatives",
                    "Adjust weekend bidding against weekdays");
            case PERIODIC -> List.of(
                    "Match anomaly days against recurring events",
                    "Check overlap with scheduled reports",
                    "Review automation schedules");
            case CONSISTENT -> List.of(
                    "Keep monitoring evenly across the week",
                    "Set daily checkpoints",
                    "Alert early on trend changes");
            case RANDOM -> List.of(
                    "Collect more data on the irregular pattern",
                    "Watch external factors such as competitors and market shifts");
        };
    }

    private static String describeCorrelation(MetricName m1, MetricName m2, CorrelationType type) {
        if (type == CorrelationType.POSITIVE) {
            return m1.getLabel() + " and " + m2.getLabel() + " tend to move together. An anomaly in one may affect the other.";
        }
        return m1.getLabel() + " and " + m2.getLabel() + " move in opposite directions. When one rises the other falls.";
    }

    private static KpiTimePattern.KpiAverages averages(List<KpiSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return KpiTimePattern.KpiAverages.builder().build();
        }
        int n = snapshots.size();
        return KpiTimePattern.KpiAverages.builder()
                .impressions(snapshots.stream().mapToLong(KpiSnapshot::getImpressions).sum() / (double) n)
                .clicks(snapshots.stream().mapToLong(KpiSnapshot::getClicks).sum() / (double) n)
                .conversions(snapshots.stream().mapToLong(KpiSnapshot::getConversions).sum() / (double) n)
                .spend(snapshots.stream().mapToDouble(KpiSnapshot::getSpend).sum() / n)
                .revenue(snapshots.stream().mapToDouble(KpiSnapshot::getRevenue).sum() / n)
                .build();
    }

    private static boolean deviates(double value, double average) {
        return average > 0 && Math.abs(value - average) / average > OUTLIER_DAY_DEVIATION;
    }

    private static boolean sameDirection(double change1, double change2) {
        return (change1 > 0 && change2 > 0) || (change1 < 0 && change2 < 0);
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private static double averageSeverity(List<Anomaly> anomalies) {
        return anomalies.stream().mapToInt(a -> severityScore(a.getSeverity())).average().orElse(0.0);
    }

    static int severityScore(AnomalySeverity severity) {
        return switch (severity) {
            case CRITICAL -> 3;
            case WARNING -> 2;
            case INFO -> 1;
        };
    }

    // Ties go to the value seen first
    private static <K> K mostFrequent(List<Anomaly> anomalies, Function<Anomaly, K> key) {
        Map<K, Integer> counts = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            counts.merge(key.apply(anomaly), 1, Integer::sum);
        }
        K best = null;
        int bestCount = 0;
        for (Map.Entry<K, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static <K> Map<K, List<Anomaly>> groupBy(List<Anomaly> anomalies, Function<Anomaly, K> key) {
        Map<K, List<Anomaly>> groups = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            groups.computeIfAbsent(key.apply(anomaly), k -> new ArrayList<>()).add(anomaly);
        }
        return groups;
    }
}
