package com.adinsight.anomaly.engine.calendar;

import com.adinsight.anomaly.model.Industry;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A recurring market event and the performance swing it is expected to cause.
 */
@Value
@Builder(toBuilder = true)
public class MarketEvent {

    String id;
    String name;
    EventCategory category;
    ImpactType impactType;
    ExpectedChange expectedChange;
    int leadDays;
    int trailDays;

    @Singular
    Map<Industry, Double> industryWeights;

    String description;
    EventDateRule dateRule;

    public double weightFor(Industry industry) {
        if (industry == null) {
            return 1.0;
        }
        return industryWeights.getOrDefault(industry, 1.0);
    }

    /** This event with its ranges scaled by the industry weight. */
    public MarketEvent forIndustry(Industry industry) {
        double weight = weightFor(industry);
        if (weight == 1.0) {
            return this;
        }
        return toBuilder().expectedChange(expectedChange.scale(weight)).build();
    }

    public EventWindow windowIn(int year) {
        return dateRule.resolve(year, leadDays, trailDays);
    }
}
