package com.adinsight.anomaly.engine.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;

/**
 * Factory for the date rules used by the event catalog.
 */
public final class EventDateRules {

    private EventDateRules() {}

    /** Same month and day every year. */
    public static EventDateRule fixed(Month month, int day) {
        return (year, lead, trail) -> EventWindow.around(LocalDate.of(year, month, day), lead, trail, false);
    }

    public static EventDateRule lunar(LunarHolidayTable.LunarHoliday holiday) {
        return (year, lead, trail) -> LunarHolidayTable.window(holiday, year, lead, trail);
    }

    /**
     * The Nth given weekday of a month shifted by {@code offsetDays}. Black Friday is the
     * day after the fourth Thursday of November.
     */
    public static EventDateRule nthWeekday(Month month, int ordinal, DayOfWeek dayOfWeek, int offsetDays) {
        return (year, lead, trail) -> {
            LocalDate date = LocalDate.of(year, month, 1)
                    .with(TemporalAdjusters.dayOfWeekInMonth(ordinal, dayOfWeek))
                    .plusDays(offsetDays);
            return EventWindow.around(date, lead, trail, false);
        };
    }

    /** Every day from the first of {@code from} to the last of {@code to}; lead and trail are ignored. */
    public static EventDateRule months(Month from, Month to) {
        return (year, lead, trail) -> {
            LocalDate start = LocalDate.of(year, from, 1);
            LocalDate end = YearMonth.of(year, to).atEndOfMonth();
            return new EventWindow(start, start, end, false);
        };
    }
}
