package com.adinsight.anomaly.repository;

import com.adinsight.anomaly.model.Campaign;
import com.adinsight.anomaly.model.DateRange;
import com.adinsight.anomaly.model.KpiSnapshot;
import com.adinsight.anomaly.model.MetricName;
import com.adinsight.anomaly.model.MetricPoint;
import com.adinsight.anomaly.port.CampaignLister;
import com.adinsight.anomaly.port.KpiReader;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local campaign and KPI store backing {@link KpiReader} and {@link CampaignLister}.
 * Deployments with a real ads data source register their own adapters instead.
 */
@Repository
public class InMemoryCampaignKpiRepository implements KpiReader, CampaignLister {

    private final Map<String, Campaign> campaigns = new ConcurrentHashMap<>();
    private final Map<String, List<String>> campaignsByUser = new ConcurrentHashMap<>();

    // campaignId -> date -> snapshot
    private final Map<String, NavigableMap<LocalDate, KpiSnapshot>> snapshots = new ConcurrentHashMap<>();

    public void saveCampaign(String userId, Campaign campaign) {
        campaigns.put(campaign.getId(), campaign);
        List<String> ids = campaignsByUser.computeIfAbsent(userId, u -> new CopyOnWriteArrayList<>());
        if (!ids.contains(campaign.getId())) {
            ids.add(campaign.getId());
        }
    }

    /** Stores the snapshot, replacing any earlier one for the same campaign and date. */
    public void saveSnapshot(KpiSnapshot snapshot) {
        snapshots.computeIfAbsent(snapshot.getCampaignId(), id -> new ConcurrentSkipListMap<>())
                .put(snapshot.getDate(), snapshot);
    }

    @Override
    public List<Campaign> activeCampaigns(String userId) {
        List<Campaign> result = new ArrayList<>();
        for (String id : campaignsByUser.getOrDefault(userId, List.of())) {
            Campaign campaign = campaigns.get(id);
            if (campaign != null) {
                result.add(campaign);
            }
        }
        return result;
    }

    @Override
    public Optional<Campaign> findById(String campaignId) {
        return Optional.ofNullable(campaigns.get(campaignId));
    }

    @Override
    public List<MetricPoint> seriesFor(String campaignId, MetricName metric, DateRange range) {
        NavigableMap<LocalDate, KpiSnapshot> byDate = snapshots.get(campaignId);
        if (byDate == null) {
            return List.of();
        }
        return byDate.subMap(range.getStart(), true, range.getEnd(), true).values().stream()
                .map(s -> s.toPoint(metric))
                .toList();
    }

    @Override
    public List<KpiSnapshot> latestTwo(String campaignId) {
        NavigableMap<LocalDate, KpiSnapshot> byDate = snapshots.get(campaignId);
        if (byDate == null || byDate.isEmpty()) {
            return List.of();
        }
        List<KpiSnapshot> latest = new ArrayList<>(byDate.descendingMap().values().stream().limit(2).toList());
        Collections.reverse(latest);
        return latest;
    }
}
