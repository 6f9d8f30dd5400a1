package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One day of raw campaign counters. Ratio metrics are derived and are 0 when the divisor is 0.
 */
@Value
@Builder
public class KpiSnapshot {

    String campaignId;
    LocalDate date;
    long impressions;
    long clicks;
    double spend;
    long conversions;
    double revenue;

    /** Click-through rate in percent. */
    public double getCtr() {
        return impressions > 0 ? (double) clicks / impressions * 100.0 : 0.0;
    }

    public double getCpa() {
        return conversions > 0 ? spend / conversions : 0.0;
    }

    public double getRoas() {
        return spend > 0 ? revenue / spend : 0.0;
    }

    public double getCpc() {
        return clicks > 0 ? spend / clicks : 0.0;
    }

    /** Conversion rate in percent. */
    public double getCvr() {
        return clicks > 0 ? (double) conversions / clicks * 100.0 : 0.0;
    }

    public double valueOf(MetricName metric) {
        return switch (metric) {
            case SPEND -> spend;
            case IMPRESSIONS -> impressions;
            case CLICKS -> clicks;
            case CONVERSIONS -> conversions;
            case CTR -> getCtr();
            case CPA -> getCpa();
            case ROAS -> getRoas();
            case CPC -> getCpc();
            case CVR -> getCvr();
        };
    }

    public MetricPoint toPoint(MetricName metric) {
        return MetricPoint.of(date, valueOf(metric));
    }
}
