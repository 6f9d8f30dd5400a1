package com.adinsight.anomaly.repository;

import com.adinsight.anomaly.model.AlertRecord;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local alert history. Lost on restart and not shared between instances.
 */
@Repository
public class InMemoryAlertHistoryStore implements AlertHistoryStore {

    private final ConcurrentHashMap<String, List<AlertRecord>> history = new ConcurrentHashMap<>();

    @Override
    public List<AlertRecord> pruneAndGet(String campaignId, Instant cutoff) {
        List<AlertRecord> remaining = history.computeIfPresent(campaignId, (id, records) -> {
            List<AlertRecord> kept = new ArrayList<>();
            for (AlertRecord record : records) {
                if (record.getTimestamp().isAfter(cutoff)) {
                    kept.add(record);
                }
            }
            return kept.isEmpty() ? null : kept;
        });
        return remaining == null ? List.of() : List.copyOf(remaining);
    }

    @Override
    public void append(AlertRecord record) {
        history.compute(record.getCampaignId(), (id, records) -> {
            List<AlertRecord> updated = records == null ? new ArrayList<>() : new ArrayList<>(records);
            updated.add(record);
            return updated;
        });
    }

    @Override
    public void pruneAll(Instant cutoff) {
        for (String campaignId : history.keySet()) {
            pruneAndGet(campaignId, cutoff);
        }
    }

    @Override
    public void clear() {
        history.clear();
    }
}
