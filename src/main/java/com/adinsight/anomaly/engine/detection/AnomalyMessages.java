package com.adinsight.anomaly.engine.detection;

import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.model.TrendDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable message and recommendations for an anomaly.
 */
final class AnomalyMessages {

    static final int MAX_RECOMMENDATIONS = 3;

    private AnomalyMessages() {}

    static String message(MetricName metric, double changePercent, TrendDirection trend) {
        boolean increase = changePercent >= 0;
        StringBuilder message = new StringBuilder(String.format(Locale.ROOT, "%s %s %.0f%%.",
                metric.getLabel(), increase ? "rose" : "fell", Math.abs(changePercent)));

        switch (metric) {
            case CPA -> {
                if (increase) message.append(" Advertising efficiency needs a review.");
            }
            case ROAS -> message.append(increase
                    ? " Keep the current strategy."
                    : " Review targeting and bidding strategy.");
            case CTR -> {
                if (!increase) message.append(" Review the ad creatives.");
            }
            case CONVERSIONS -> {
                if (!increase) message.append(" Check the landing page and targeting.");
            }
            case CPC -> {
                if (increase) message.append(" Auction costs are climbing.");
            }
            default -> {
            }
        }

        if (trend == TrendDirection.VOLATILE) {
            message.append(" (performance is volatile)");
        } else if (trend == TrendDirection.INCREASING && !increase) {
            message.append(" (drop against an upward trend)");
        } else if (trend == TrendDirection.DECREASING && increase) {
            message.append(" (rebound against a downward trend)");
        }
        return message.toString();
    }

    static List<String> recommendations(MetricName metric, boolean increase, TrendDirection trend) {
        List<String> recommendations = new ArrayList<>();
        switch (metric) {
            case CPA -> {
                if (increase) {
                    recommendations.add("Narrow the target audience segments");
                    recommendations.add("Run an A/B test on the ad creatives");
                    recommendations.add("Adjust the bidding strategy");
                }
            }
            case ROAS -> {
                if (increase) {
                    recommendations.add("Analyse what drove the improvement");
                    recommendations.add("Apply the same strategy to similar campaigns");
                } else {
                    recommendations.add("Verify conversion tracking");
                    recommendations.add("Review landing page performance");
                    recommendations.add("Monitor competitor activity");
                }
            }
            case CTR, CLICKS -> {
                if (!increase) {
                    recommendations.add("Refresh the ad creatives");
                    recommendations.add("Review the targeting settings");
                    recommendations.add("Check for ad fatigue");
                }
            }
            case CONVERSIONS, CVR -> {
                if (!increase) {
                    recommendations.add("Check the pixel and conversion tracking");
                    recommendations.add("Check landing page load speed");
                    recommendations.add("Review price competitiveness");
                }
            }
            case SPEND -> {
                if (increase) {
                    recommendations.add("Check the daily budget cap");
                    recommendations.add("Check the bid limits");
                    recommendations.add("Look for unexpected auction competition");
                }
            }
            case CPC -> {
                if (increase) {
                    recommendations.add("Review bid caps");
                    recommendations.add("Improve ad quality to win cheaper auctions");
                }
            }
            case IMPRESSIONS -> {
                if (!increase) {
                    recommendations.add("Expand the target audience");
                    recommendations.add("Check for ad policy restrictions");
                }
            }
        }

        if (trend == TrendDirection.VOLATILE) {
            recommendations.add("Keep campaign settings consistent");
            recommendations.add("Check external factors such as seasonality and events");
        }

        return recommendations.size() > MAX_RECOMMENDATIONS
                ? List.copyOf(recommendations.subList(0, MAX_RECOMMENDATIONS))
                : List.copyOf(recommendations);
    }
}
