package com.adinsight.anomaly.repository;

import com.adinsight.anomaly.model.AlertRecord;

import java.time.Instant;
import java.util.List;

/**
 * Rolling per-campaign history of delivered alerts, used for rate limiting and deduplication.
 */
public interface AlertHistoryStore {

    /**
     * Drops records for the campaign older than {@code cutoff} and returns what remains,
     * oldest first.
     */
    List<AlertRecord> pruneAndGet(String campaignId, Instant cutoff);

    void append(AlertRecord record);

    /**
     * Drops records older than {@code cutoff} for every campaign, removing campaigns left empty.
     */
    void pruneAll(Instant cutoff);

    void clear();
}
