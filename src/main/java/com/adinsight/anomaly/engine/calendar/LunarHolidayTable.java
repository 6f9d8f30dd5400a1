package com.adinsight.anomaly.engine.calendar;

import java.time.LocalDate;
import java.time.Month;
import java.util.Map;

/**
 * Pre-computed Gregorian dates of the two lunar holidays. Years outside the table
 * fall back to a fixed approximate date and are flagged as such.
 */
public final class LunarHolidayTable {

    public enum LunarHoliday {
        LUNAR_NEW_YEAR(Month.FEBRUARY, 1),
        CHUSEOK(Month.SEPTEMBER, 20);

        private final Month fallbackMonth;
        private final int fallbackDay;

        LunarHoliday(Month fallbackMonth, int fallbackDay) {
            this.fallbackMonth = fallbackMonth;
            this.fallbackDay = fallbackDay;
        }
    }

    private static final Map<Integer, LocalDate> LUNAR_NEW_YEAR = Map.of(
            2024, LocalDate.of(2024, 2, 10),
            2025, LocalDate.of(2025, 1, 29),
            2026, LocalDate.of(2026, 2, 17),
            2027, LocalDate.of(2027, 2, 6),
            2028, LocalDate.of(2028, 1, 26),
            2029, LocalDate.of(2029, 2, 13),
            2030, LocalDate.of(2030, 2, 3));

    private static final Map<Integer, LocalDate> CHUSEOK = Map.of(
            2024, LocalDate.of(2024, 9, 17),
            2025, LocalDate.of(2025, 10, 6),
            2026, LocalDate.of(2026, 9, 25),
            2027, LocalDate.of(2027, 9, 15),
            2028, LocalDate.of(2028, 10, 3),
            2029, LocalDate.of(2029, 9, 22),
            2030, LocalDate.of(2030, 9, 12));

    private LunarHolidayTable() {}

    public static boolean covers(LunarHoliday holiday, int year) {
        return table(holiday).containsKey(year);
    }

    /**
     * Window for the holiday in {@code year}; approximate when the year is not in the table.
     */
    public static EventWindow window(LunarHoliday holiday, int year, int leadDays, int trailDays) {
        LocalDate known = table(holiday).get(year);
        if (known != null) {
            return EventWindow.around(known, leadDays, trailDays, false);
        }
        LocalDate fallback = LocalDate.of(year, holiday.fallbackMonth, holiday.fallbackDay);
        return EventWindow.around(fallback, leadDays, trailDays, true);
    }

    private static Map<Integer, LocalDate> table(LunarHoliday holiday) {
        return switch (holiday) {
            case LUNAR_NEW_YEAR -> LUNAR_NEW_YEAR;
            case CHUSEOK -> CHUSEOK;
        };
    }
}
