package com.adinsight.anomaly.service;

import com.adinsight.anomaly.config.AlertConfig;
import com.adinsight.anomaly.model.Anomaly;
import com.adinsight.anomaly.model.AnomalySeverity;
import com.adinsight.anomaly.model.MarketContext;
import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.port.EmailMessage;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Turns one anomaly into an alert email. All caller-supplied text is HTML-escaped.
 */
@Component
public class AlertEmailRenderer {

    private static final DateTimeFormatter DETECTED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ROOT);

    private final AlertConfig config;
    private final Clock clock;

    public AlertEmailRenderer(AlertConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public EmailMessage render(String to, String userName, Anomaly anomaly) {
        return EmailMessage.builder()
                .to(to)
                .subject(subject(anomaly))
                .html(html(userName, anomaly))
                .build();
    }

    String subject(Anomaly anomaly) {
        return String.format("%s %s %s anomaly: %s",
                config.getSubjectPrefix(),
                severityLabel(anomaly.getSeverity()),
                anomaly.getMetric().getLabel(),
                anomaly.getCampaignName());
    }

    String html(String userName, Anomaly anomaly) {
        String color = severityColor(anomaly.getSeverity());
        String direction = anomaly.isIncrease() ? "up" : "down";
        String greeting = userName == null || userName.isBlank() ? "Hello," : "Hello " + escape(userName) + ",";

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head><meta charset=\"UTF-8\"><title>Campaign anomaly alert</title></head>\n")
                .append("<body style=\"margin:0;padding:0;font-family:Arial,sans-serif;background-color:#f9fafb;\">\n")
                .append("<div style=\"max-width:600px;margin:0 auto;background-color:#ffffff;padding:32px;\">\n")
                .append("<p style=\"color:#374151;font-size:16px;\">").append(greeting).append("</p>\n");

        html.append("<div style=\"border-left:4px solid ").append(color).append(";padding:16px;margin-bottom:24px;\">\n")
                .append("<h2 style=\"margin:0 0 8px;color:").append(color).append(";font-size:18px;\">")
                .append(severityLabel(anomaly.getSeverity())).append(' ').append(escape(anomaly.getMessage())).append("</h2>\n")
                .append("<p style=\"margin:0;color:#6b7280;font-size:14px;\">Campaign: <strong>")
                .append(escape(anomaly.getCampaignName())).append("</strong></p>\n</div>\n");

        // Statistical paths measure the change against a baseline rather than the previous day
        boolean againstBaseline = anomaly.getReferenceValue() != anomaly.getPreviousValue();
        html.append("<table role=\"presentation\" style=\"width:100%;margin-bottom:24px;\"><tr>\n");
        appendValueCell(html, "Previous", anomaly.getMetric(), anomaly.getPreviousValue());
        if (againstBaseline) {
            appendValueCell(html, "Baseline", anomaly.getMetric(), anomaly.getReferenceValue());
        }
        appendValueCell(html, "Current", anomaly.getMetric(), anomaly.getCurrentValue());
        html.append("</tr></table>\n");

        html.append("<p style=\"text-align:center;color:#92400e;font-size:14px;\"><strong>")
                .append(String.format(Locale.ROOT, "%.1f%% %s %s", Math.abs(anomaly.getChangePercent()), direction,
                        againstBaseline ? "vs baseline" : "vs previous day"))
                .append("</strong></p>\n");

        appendMarketContext(html, anomaly.getMarketContext());
        appendRecommendations(html, anomaly.getRecommendations());
        appendDetectionDetails(html, anomaly);

        if (config.getDashboardUrl() != null && !config.getDashboardUrl().isBlank()) {
            html.append("<p style=\"margin-top:32px;text-align:center;\"><a href=\"")
                    .append(escape(config.getDashboardUrl()))
                    .append("\" style=\"padding:12px 32px;background-color:#667eea;color:#ffffff;text-decoration:none;\">")
                    .append("Open the dashboard</a></p>\n");
        }

        html.append("<p style=\"color:#6b7280;font-size:12px;\">This alert was sent automatically by campaign anomaly detection.</p>\n")
                .append("</div>\n</body>\n</html>\n");
        return html.toString();
    }

    private static void appendValueCell(StringBuilder html, String label, MetricName metric, double value) {
        html.append("<td><p style=\"color:#6b7280;font-size:12px;\">").append(label)
                .append("</p><p style=\"font-size:20px;\">").append(formatMetricValue(metric, value))
                .append("</p></td>\n");
    }

    private void appendMarketContext(StringBuilder html, MarketContext context) {
        if (context == null || !context.isSpecialDay()) {
            return;
        }
        html.append("<div style=\"background-color:#fef3c7;padding:16px;margin:24px 0;\">\n")
                .append("<h3 style=\"margin:0 0 8px;color:#92400e;font-size:14px;\">Market context</h3>\n")
                .append("<p style=\"margin:0;color:#92400e;font-size:13px;\">")
                .append(escape(String.join(", ", context.getEvents()))).append(" in effect. ")
                .append(context.isWithinExpectedRange() ? "The change is within the expected range." : "The change is outside the expected range.");
        if (context.getExpectedMinChange() != null && context.getExpectedMaxChange() != null) {
            html.append(String.format(Locale.ROOT, " Expected: %.0f%% to %.0f%%.",
                    context.getExpectedMinChange(), context.getExpectedMaxChange()));
        }
        html.append("</p>\n</div>\n");
    }

    private void appendRecommendations(StringBuilder html, List<String> recommendations) {
        if (recommendations == null || recommendations.isEmpty()) {
            return;
        }
        html.append("<h3 style=\"color:#111827;font-size:16px;\">Recommended actions</h3>\n<ul>\n");
        for (String recommendation : recommendations) {
            html.append("<li>").append(escape(recommendation)).append("</li>\n");
        }
        html.append("</ul>\n");
    }

    private void appendDetectionDetails(StringBuilder html, Anomaly anomaly) {
        html.append("<div style=\"margin-top:24px;padding:16px;background-color:#f9fafb;\">\n")
                .append("<h3 style=\"margin:0 0 8px;color:#6b7280;font-size:12px;\">DETECTION DETAILS</h3>\n")
                .append("<p style=\"margin:0;color:#6b7280;font-size:13px;\">Method: ")
                .append(anomaly.getDetectionMethod().getLabel());
        if (anomaly.getDetectedAt() != null) {
            html.append("<br>Detected at: ").append(DETECTED_AT.format(anomaly.getDetectedAt().atZone(clock.getZone())));
        }
        if (anomaly.getZScore() != null) {
            html.append(String.format(Locale.ROOT, "<br>Z-score: %.2f", anomaly.getZScore()));
        }
        if (anomaly.getHistoricalTrend() != null) {
            html.append("<br>Trend: ").append(anomaly.getHistoricalTrend().name().toLowerCase(Locale.ROOT));
        }
        html.append("</p>\n</div>\n");
    }

    static String formatMetricValue(MetricName metric, double value) {
        return switch (metric) {
            case SPEND, CPA, CPC -> String.format(Locale.US, "₩%,.0f", value);
            case ROAS -> String.format(Locale.ROOT, "%.2fx", value);
            case CTR, CVR -> String.format(Locale.ROOT, "%.2f%%", value);
            case IMPRESSIONS, CLICKS, CONVERSIONS -> String.format(Locale.US, "%,.0f", value);
        };
    }

    private static String severityLabel(AnomalySeverity severity) {
        return switch (severity) {
            case CRITICAL -> "[CRITICAL]";
            case WARNING -> "[WARNING]";
            case INFO -> "[INFO]";
        };
    }

    private static String severityColor(AnomalySeverity severity) {
        return switch (severity) {
            case CRITICAL -> "#dc2626";
            case WARNING -> "#f59e0b";
            case INFO -> "#3b82f6";
        };
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
