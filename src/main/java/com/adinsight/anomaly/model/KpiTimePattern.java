package com.adinsight.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Average daily KPIs split by weekday, weekend and day of week, plus the days whose spend or
 * clicks strayed more than half from the overall average.
 */
@Value
@Builder
public class KpiTimePattern {

    KpiAverages weekdayAverage;
    KpiAverages weekendAverage;
    Map<DayOfWeek, KpiAverages> dayOfWeekAverage;
    List<LocalDate> outlierDays;

    @Value
    @Builder
    public static class KpiAverages {
        double impressions;
        double clicks;
        double conversions;
        double spend;
        double revenue;
    }
}
