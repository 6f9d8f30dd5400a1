package com.adinsight.anomaly.port;

import com.adinsight.anomaly.model.DateRange;
import com.adinsight.anomaly.model.KpiSnapshot;
import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.model.MetricPoint;

import java.util.List;

/**
 * Read-only access to daily campaign KPIs.
 */
public interface KpiReader {

    /**
     * Daily values of one metric within the range, in chronological order.
     */
    List<MetricPoint> seriesFor(String campaignId, MetricName metric, DateRange range);

    /**
     * The two most recent daily snapshots as {@code [previous, latest]}; fewer when the
     * campaign has less history.
     */
    List<KpiSnapshot> latestTwo(String campaignId);
}
