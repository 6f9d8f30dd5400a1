package com.adinsight.anomaly.engine.rootcause;

import com.adinsight.anomaly.config.RootCauseConfig;
import com.adinsight.anomaly.engine.calendar.ChangeRange;
import com.adinsight.anomaly.engine.calendar.DateEventInfo;
import com.adinsight.anomaly.engine.calendar.MarketCalendarProvider;
import com.adinsight.anomaly.model.ActionPriority;
import com.adinsight.anomaly.model.ActionTimeframe;
import com.adinsight.anomaly.model.AnalysisContext;
import com.adinsight.anomaly.model.Anomaly;
import com.adinsight.anomaly.model.AnomalySeverity;
import com.adinsight.anomaly.model.CampaignChange;
import com.adinsight.anomaly.model.CauseCategory;
import com.adinsight.anomaly.model.CauseConfidence;
import com.adinsight.anomaly.model.PossibleCause;
import com.adinsight.anomaly.model.RootCauseAction;
import com.adinsight.anomaly.model.RootCauseAnalysis;
import com.adinsight.anomaly.model.UrgencyLevel;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Explains an anomaly by matching it against the cause rule table and the analysis context.
 *
 * <p>Each applicable template yields a candidate cause whose probability is the template's
 * base confidence scaled by anomaly severity, change magnitude and context signals.
 * Two context-driven causes are added on top: market events on the analysis date, and
 * campaign changes made within the lookback window.</p>
 */
@Component
public class RootCauseAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RootCauseAnalyzer.class);

    static final String MARKET_CAUSE_ID = "market_special_day";
    static final String RECENT_CHANGES_CAUSE_ID = "recent_changes";

    private static final Comparator<PossibleCause> RANKING = Comparator
            .comparingDouble(PossibleCause::getProbability).reversed()
            .thenComparing(PossibleCause::getConfidence)
            .thenComparing(PossibleCause::mostUrgentAction);

    private final CauseRuleTable ruleTable;
    private final MarketCalendarProvider calendarProvider;
    private final RootCauseConfig config;
    private final Clock clock;

    public RootCauseAnalyzer(CauseRuleTable ruleTable,
                             MarketCalendarProvider calendarProvider,
                             RootCauseConfig config,
                             Clock clock) {
        this.ruleTable = ruleTable;
        this.calendarProvider = calendarProvider;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param context may be null; confidence of every template cause is lowered one level then
     * @throws IllegalArgumentException when the context is malformed
     */
    @Observed(name = "anomaly.root-cause", contextualName = "analyze-root-cause")
    public RootCauseAnalysis analyzeRootCause(Anomaly anomaly, AnalysisContext context) {
        if (context != null) {
            context.validate();
        }

        List<PossibleCause> candidates = new ArrayList<>(templateCauses(anomaly, context));
        if (context != null) {
            marketCause(anomaly, context).ifPresent(candidates::add);
            recentChangesCause(context).ifPresent(candidates::add);
        }

        List<PossibleCause> allCauses = candidates.stream().sorted(RANKING).toList();
        List<PossibleCause> topCauses = allCauses.stream().limit(config.getMaxTopCauses()).toList();

        RootCauseAnalysis analysis = RootCauseAnalysis.builder()
                .anomalyId(anomaly.getId())
                .metric(anomaly.getMetric())
                .analyzedAt(clock.instant())
                .topCauses(topCauses)
                .allCauses(allCauses)
                .urgencyLevel(urgency(anomaly, topCauses))
                .summary(summary(anomaly, topCauses))
                .nextSteps(nextSteps(topCauses))
                .build();

        log.debug("Root cause for {}: {} candidates, urgency {}, top {}",
                anomaly.getId(), allCauses.size(), analysis.getUrgencyLevel(),
                topCauses.isEmpty() ? "none" : topCauses.get(0).getId());
        return analysis;
    }

    public List<PossibleCause> filterCausesByCategory(RootCauseAnalysis analysis, CauseCategory category) {
        return analysis.getAllCauses().stream()
                .filter(c -> c.getCategory() == category)
                .toList();
    }

    /**
     * Actions of every cause at or above {@code minPriority}, one per action id, most urgent first.
     */
    public List<RootCauseAction> getHighPriorityActions(RootCauseAnalysis analysis, ActionPriority minPriority) {
        Map<String, RootCauseAction> byId = new LinkedHashMap<>();
        for (PossibleCause cause : analysis.getAllCauses()) {
            for (RootCauseAction action : cause.getActions()) {
                if (action.getPriority().isAtLeast(minPriority)) {
                    byId.putIfAbsent(action.getId(), action);
                }
            }
        }
        return byId.values().stream()
                .sorted(Comparator.comparing(RootCauseAction::getPriority))
                .toList();
    }

    private List<PossibleCause> templateCauses(Anomaly anomaly, AnalysisContext context) {
        boolean increase = anomaly.isIncrease();
        double magnitude = Math.abs(anomaly.getChangePercent());

        List<PossibleCause> causes = new ArrayList<>();
        for (CauseTemplate template : ruleTable.templatesFor(anomaly.getMetric())) {
            if (!template.appliesTo(increase, anomaly.getSeverity(), magnitude)) {
                continue;
            }
            double probability = probability(template, anomaly, context);
            if (probability < config.getMinProbability()) {
                continue;
            }
            causes.add(PossibleCause.builder()
                    .id(template.getId())
                    .category(template.getCategory())
                    .name(template.getName())
                    .description(template.getDescription())
                    .probability(probability)
                    .confidence(adjustConfidence(template.getBaseConfidence(), anomaly, context))
                    .evidence(template.getEvidence())
                    .actions(template.getActions())
                    .build());
        }
        return causes;
    }

    double probability(CauseTemplate template, Anomaly anomaly, AnalysisContext context) {
        double p = template.getBaseConfidence().getBaseProbability()
                * severityFactor(anomaly.getSeverity())
                * magnitudeFactor(Math.abs(anomaly.getChangePercent()));

        if (context != null) {
            if (context.isTechnicalIssues() && template.getCategory() == CauseCategory.TECHNICAL) {
                p *= 1.3;
            }
            if (context.isCompetitorActivity() && template.getCategory() == CauseCategory.EXTERNAL) {
                p *= 1.2;
            }
            if (!qualifyingChanges(context).isEmpty() && template.getCategory() == CauseCategory.INTERNAL) {
                p *= 1.15;
            }
        }
        return Math.min(p, config.getProbabilityCap());
    }

    private static double severityFactor(AnomalySeverity severity) {
        return switch (severity) {
            case CRITICAL -> 1.2;
            case WARNING -> 1.1;
            case INFO -> 0.9;
        };
    }

    private static double magnitudeFactor(double absChangePercent) {
        if (absChangePercent > 50) {
            return 1.15;
        }
        if (absChangePercent > 30) {
            return 1.1;
        }
        return absChangePercent < 10 ? 0.85 : 1.0;
    }

    private static CauseConfidence adjustConfidence(CauseConfidence base, Anomaly anomaly, AnalysisContext context) {
        if (anomaly.getZScore() != null && Math.abs(anomaly.getZScore()) > 3) {
            return base.raise();
        }
        if (context == null) {
            return base.lower();
        }
        return base;
    }

    private Optional<PossibleCause> marketCause(Anomaly anomaly, AnalysisContext context) {
        DateEventInfo info = calendarProvider.forDate(context.getCurrentDate())
                .getDateEventInfo(context.getCurrentDate(), context.getIndustry());
        if (!info.isSpecialDay()) {
            return Optional.empty();
        }

        String events = String.join(", ", info.eventNames());
        ChangeRange range = info.getCombinedExpectedChange().get(anomaly.getMetric().getChangeKey());

        List<String> evidence = new ArrayList<>();
        evidence.add("Market events: " + events);
        evidence.add(String.format(Locale.ROOT, "Expected change range: %.0f%% to %.0f%%", range.getMin(), range.getMax()));
        if (range.contains(anomaly.getChangePercent())) {
            evidence.add(String.format(Locale.ROOT, "Observed change %.1f%% is within the expected range",
                    anomaly.getChangePercent()));
        }

        return Optional.of(PossibleCause.builder()
                .id(MARKET_CAUSE_ID)
                .category(CauseCategory.MARKET)
                .name("Special day effect")
                .description("Performance swings are expected during " + events + ".")
                .probability(Math.min(config.getMarketCauseProbability(), config.getProbabilityCap()))
                .confidence(CauseConfidence.HIGH)
                .evidence(evidence)
                .actions(List.of(
                        CauseRuleTable.action("monitor_trend", ActionPriority.LOW, "Monitor the trend",
                                "Keep monitoring performance until the event period ends.",
                                "Confirms the normal pattern", ActionTimeframe.WITHIN_WEEK),
                        CauseRuleTable.action("seasonal_strategy", ActionPriority.MEDIUM, "Apply a seasonal strategy",
                                "Adapt the campaign strategy to the season.",
                                "Maximises seasonal revenue", ActionTimeframe.IMMEDIATE)))
                .build());
    }

    private Optional<PossibleCause> recentChangesCause(AnalysisContext context) {
        List<CampaignChange> changes = qualifyingChanges(context);
        if (changes.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(PossibleCause.builder()
                .id(RECENT_CHANGES_CAUSE_ID)
                .category(CauseCategory.INTERNAL)
                .name("Recent campaign changes")
                .description("Recent changes to the campaign settings may have affected performance.")
                .probability(Math.min(config.getRecentChangeProbability(), config.getProbabilityCap()))
                .confidence(CauseConfidence.HIGH)
                .evidence(changes.stream().map(c -> c.getType() + ": " + c.getDescription()).toList())
                .actions(List.of(
                        CauseRuleTable.action("review_changes", ActionPriority.HIGH, "Review recent changes",
                                "Review the recent changes and roll back where needed.",
                                "Cause identified", ActionTimeframe.IMMEDIATE),
                        CauseRuleTable.action("ab_test_changes", ActionPriority.MEDIUM, "A/B test the changes",
                                "Compare performance before and after the change with an A/B test.",
                                "Change effect verified", ActionTimeframe.WITHIN_WEEK)))
                .build());
    }

    private List<CampaignChange> qualifyingChanges(AnalysisContext context) {
        LocalDate cutoff = context.getCurrentDate().minusDays(config.getRecentChangeLookbackDays());
        return context.getRecentChanges().stream()
                .filter(c -> !c.getChangedAt().isBefore(cutoff))
                .toList();
    }

    private static UrgencyLevel urgency(Anomaly anomaly, List<PossibleCause> topCauses) {
        if (anomaly.getSeverity() == AnomalySeverity.CRITICAL) {
            return UrgencyLevel.CRITICAL;
        }
        if (topCauses.stream().anyMatch(c -> c.hasActionWithPriority(ActionPriority.CRITICAL))) {
            return UrgencyLevel.HIGH;
        }
        if (anomaly.getSeverity() == AnomalySeverity.WARNING) {
            boolean technical = topCauses.stream().anyMatch(c -> c.getCategory() == CauseCategory.TECHNICAL);
            return technical ? UrgencyLevel.HIGH : UrgencyLevel.MEDIUM;
        }
        return UrgencyLevel.LOW;
    }

    private static String summary(Anomaly anomaly, List<PossibleCause> topCauses) {
        String direction = anomaly.isIncrease() ? "rose" : "fell";
        String head = String.format(Locale.ROOT, "%s %s %.1f%%.",
                anomaly.getMetric().getLabel(), direction, Math.abs(anomaly.getChangePercent()));
        if (topCauses.isEmpty()) {
            return head + " No likely cause identified; a detailed review is recommended.";
        }

        String causes = topCauses.stream().map(PossibleCause::getName).collect(Collectors.joining(", "));
        List<RootCauseAction> firstActions = topCauses.get(0).getActions();
        String firstStep = firstActions.isEmpty() ? "a detailed review" : firstActions.get(0).getTitle();
        return head + " Likely causes: " + causes + ". Recommended first step: " + firstStep + ".";
    }

    private List<String> nextSteps(List<PossibleCause> topCauses) {
        Map<String, RootCauseAction> byTitle = new LinkedHashMap<>();
        for (PossibleCause cause : topCauses) {
            for (RootCauseAction action : cause.getActions()) {
                byTitle.putIfAbsent(action.getTitle(), action);
            }
        }
        return byTitle.values().stream()
                .sorted(Comparator.comparing(RootCauseAction::getPriority))
                .limit(config.getMaxNextSteps())
                .map(RootCauseAction::toNextStep)
                .toList();
    }
}
