package com.adinsight.anomaly.engine.calendar;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Events in effect on one date, with industry weights already applied.
 */
@Value
@Builder
public class DateEventInfo {

    LocalDate date;
    List<MarketEvent> events;
    boolean specialDay;

    // Union envelope of the events' ranges; all zero on ordinary days
    ExpectedChange combinedExpectedChange;

    boolean approximate;

    public List<String> eventNames() {
        return events.stream().map(MarketEvent::getName).toList();
    }
}
