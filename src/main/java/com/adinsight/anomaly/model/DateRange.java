package com.adinsight.anomaly.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive day range.
 */
@Value
public class DateRange {

    LocalDate start;
    LocalDate end;

    public DateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Date range end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public static DateRange lastDays(LocalDate end, int days) {
        return new DateRange(end.minusDays(days), end);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
