package com.adinsight.anomaly.engine.calendar;

import com.adinsight.anomaly.model.ExpectedChangeKey;
import com.adinsight.anomaly.model.Industry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable, year-scoped view of the market event catalog.
 *
 * <p>Every event is resolved for the calendar year and its neighbours, so windows that
 * cross New Year (Christmas trailing into January, New Year's lead into December) are
 * still seen. Queries for dates outside the calendar year are rejected.</p>
 *
 * <p>On a special day the expected ranges of all events in effect are combined into
 * their union envelope: the smallest minimum and the largest maximum, never a sum.</p>
 */
public final class MarketCalendar {

    private static final Logger log = LoggerFactory.getLogger(MarketCalendar.class);

    private final int year;
    private final List<ResolvedEvent> resolved;

    private MarketCalendar(int year, List<ResolvedEvent> resolved) {
        this.year = year;
        this.resolved = resolved;
    }

    public static MarketCalendar forYear(int year) {
        return forYear(year, MarketEventCatalog.all());
    }

    static MarketCalendar forYear(int year, List<MarketEvent> catalog) {
        List<ResolvedEvent> resolved = new ArrayList<>();
        for (MarketEvent event : catalog) {
            for (int y = year - 1; y <= year + 1; y++) {
                EventWindow window = event.windowIn(y);
                if (window.getEnd().getYear() >= year && window.getStart().getYear() <= year) {
                    if (window.isApproximate()) {
                        log.warn("No known date for {} in {}; approximating with {}",
                                event.getId(), y, window.getEventDate());
                    }
                    resolved.add(new ResolvedEvent(event, window));
                }
            }
        }
        return new MarketCalendar(year, Collections.unmodifiableList(resolved));
    }

    public int getYear() {
        return year;
    }

    public DateEventInfo getDateEventInfo(LocalDate date, Industry industry) {
        requireInYear(date);

        List<MarketEvent> events = new ArrayList<>();
        boolean approximate = false;
        for (ResolvedEvent r : resolved) {
            if (r.window.contains(date)) {
                events.add(r.event.forIndustry(industry));
                approximate |= r.window.isApproximate();
            }
        }

        return DateEventInfo.builder()
                .date(date)
                .events(List.copyOf(events))
                .specialDay(!events.isEmpty())
                .combinedExpectedChange(combine(events))
                .approximate(approximate)
                .build();
    }

    public boolean isSpecialDay(LocalDate date, Industry industry) {
        return getDateEventInfo(date, industry).isSpecialDay();
    }

    /**
     * Special days between {@code start} and {@code end} inclusive, in date order.
     */
    public List<DateEventInfo> getSpecialDaysInRange(LocalDate start, LocalDate end, Industry industry) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
        requireInYear(start);
        requireInYear(end);

        List<DateEventInfo> specialDays = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            DateEventInfo info = getDateEventInfo(d, industry);
            if (info.isSpecialDay()) {
                specialDays.add(info);
            }
        }
        return specialDays;
    }

    /**
     * Whether the change falls inside the combined expected range. Always false on ordinary days.
     */
    public boolean isChangeWithinExpectedRange(LocalDate date, ExpectedChangeKey key,
                                               double changePercent, Industry industry) {
        DateEventInfo info = getDateEventInfo(date, industry);
        if (!info.isSpecialDay()) {
            return false;
        }
        return info.getCombinedExpectedChange().get(key).contains(changePercent);
    }

    /**
     * Widens a detection threshold on special days: by the range maximum for positive
     * changes, by the absolute minimum for negative ones. Unchanged on ordinary days.
     */
    public double getAdjustedThreshold(LocalDate date, double baseThreshold, ExpectedChangeKey key,
                                       boolean positive, Industry industry) {
        DateEventInfo info = getDateEventInfo(date, industry);
        if (!info.isSpecialDay()) {
            return baseThreshold;
        }
        ChangeRange range = info.getCombinedExpectedChange().get(key);
        return baseThreshold + (positive ? range.getMax() : Math.abs(range.getMin()));
    }

    private static ExpectedChange combine(List<MarketEvent> events) {
        if (events.isEmpty()) {
            return ExpectedChange.NONE;
        }
        ExpectedChange combined = events.get(0).getExpectedChange();
        for (int i = 1; i < events.size(); i++) {
            combined = combined.union(events.get(i).getExpectedChange());
        }
        return combined;
    }

    private void requireInYear(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Date must not be null");
        }
        if (date.getYear() != year) {
            throw new IllegalArgumentException("Date " + date + " is outside the " + year + " market calendar");
        }
    }

    private static final class ResolvedEvent {
        private final MarketEvent event;
        private final EventWindow window;

        private ResolvedEvent(MarketEvent event, EventWindow window) {
            this.event = event;
            this.window = window;
        }
    }
}
