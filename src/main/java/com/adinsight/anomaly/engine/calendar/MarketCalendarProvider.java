package com.adinsight.anomaly.engine.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one immutable {@link MarketCalendar} per year, built on first use.
 */
@Component
public class MarketCalendarProvider {

    private static final Logger log = LoggerFactory.getLogger(MarketCalendarProvider.class);

    private final Map<Integer, MarketCalendar> calendars = new ConcurrentHashMap<>();

    public MarketCalendar forYear(int year) {
        return calendars.computeIfAbsent(year, y -> {
            MarketCalendar calendar = MarketCalendar.forYear(y);
            log.info("Built market calendar for {}", y);
            return calendar;
        });
    }

    public MarketCalendar forDate(LocalDate date) {
        return forYear(date.getYear());
    }
}
