package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Calendar context attached to an anomaly: which market events were in effect on the
 * evaluation date and the change range they imply for the anomaly's metric.
 */
@Value
@Builder
public class MarketContext {

    boolean specialDay;
    List<String> events;

    // Expected change in percent for the metric's change key; null on ordinary days
    Double expectedMinChange;
    Double expectedMaxChange;

    boolean withinExpectedRange;

    // True when a lunar holiday date had to be approximated
    boolean approximate;

    public static MarketContext ordinaryDay() {
        return MarketContext.builder().specialDay(false).events(List.of()).build();
    }
}
