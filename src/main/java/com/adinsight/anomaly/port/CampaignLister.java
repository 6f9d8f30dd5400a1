package com.adinsight.anomaly.port;

import com.adinsight.anomaly.model.Campaign;

import java.util.List;
import java.util.Optional;

public interface CampaignLister {

    List<Campaign> activeCampaigns(String userId);

    Optional<Campaign> findById(String campaignId);
}
