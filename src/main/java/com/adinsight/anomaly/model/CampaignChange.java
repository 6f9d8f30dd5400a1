package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A configuration change made to a campaign, as reported by the caller.
 */
@Value
@Builder
public class CampaignChange {
    ChangeType type;
    LocalDate changedAt;
    String description;
}
