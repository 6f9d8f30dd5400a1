package com.adinsight.anomaly.engine.calendar;

/**
 * Resolves an event to the window it affects in a given year.
 */
@FunctionalInterface
public interface EventDateRule {

    EventWindow resolve(int year, int leadDays, int trailDays);
}
