package com.adinsight.anomaly.engine.calendar;

import lombok.Value;

import java.time.LocalDate;

/**
 * The days an event affects in one particular year, bounds inclusive.
 */
@Value
public class EventWindow {

    LocalDate eventDate;
    LocalDate start;
    LocalDate end;

    // The event date came from a fallback rather than a known date
    boolean approximate;

    public static EventWindow around(LocalDate eventDate, int leadDays, int trailDays, boolean approximate) {
        return new EventWindow(eventDate, eventDate.minusDays(leadDays), eventDate.plusDays(trailDays), approximate);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
