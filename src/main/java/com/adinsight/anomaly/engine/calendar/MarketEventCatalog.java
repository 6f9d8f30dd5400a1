package com.adinsight.anomaly.engine.calendar;

import com.adinsight.anomaly.engine.calendar.LunarHolidayTable.LunarHoliday;
import com.adinsight.anomaly.model.Industry;

import java.time.DayOfWeek;
import java.time.Month;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.adinsight.anomaly.engine.calendar.ChangeRange.of;

/**
 * Static catalog of Korean public holidays, commercial events and seasonal windows,
 * keyed by event id.
 */
public final class MarketEventCatalog {

    private static final Map<String, MarketEvent> EVENTS = new LinkedHashMap<>();

    static {
        // Public holidays
        register(MarketEvent.builder()
                .id("NEW_YEAR").name("New Year's Day")
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.NEGATIVE)
                .expectedChange(ExpectedChange.of(of(-40, -20), of(-50, -30), of(-20, -5)))
                .leadDays(1).trailDays(1)
                .description("Holiday break at the start of the year depresses performance")
                .dateRule(EventDateRules.fixed(Month.JANUARY, 1))
                .build());
        register(MarketEvent.builder()
                .id("SEOLLAL").name("Lunar New Year")
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.MIXED)
                .expectedChange(ExpectedChange.of(of(-30, 50), of(-40, 30), of(-20, 10)))
                .leadDays(7).trailDays(3)
                .industryWeight(Industry.ECOMMERCE, 1.3)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.5)
                .industryWeight(Industry.FASHION, 1.2)
                .industryWeight(Industry.BEAUTY, 1.1)
                .description("Holiday gift season lifts some industries")
                .dateRule(EventDateRules.lunar(LunarHoliday.LUNAR_NEW_YEAR))
                .build());
        register(MarketEvent.builder()
                .id("INDEPENDENCE_DAY").name("Independence Movement Day")
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.NEGATIVE)
                .expectedChange(ExpectedChange.of(of(-20, -10), of(-25, -10), of(-15, -5)))
                .description("Public holiday with a general dip")
                .dateRule(EventDateRules.fixed(Month.MARCH, 1))
                .build());
        register(MarketEvent.builder()
                .id("CHILDREN_DAY").name("Children's Day")
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(10, 60), of(20, 80), of(5, 25)))
                .leadDays(14).trailDays(1)
                .industryWeight(Industry.ECOMMERCE, 1.5)
                .industryWeight(Industry.EDUCATION, 1.3)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.2)
                .description("Gift season with strong lifts in related industries")
                .dateRule(EventDateRules.fixed(Month.MAY, 5))
                .build());
        register(MarketEvent.builder()
                .id("PARENTS_DAY").name("Parents' Day")
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(10, 40), of(15, 50), of(5, 15)))
                .leadDays(7)
                .industryWeight(Industry.BEAUTY, 1.4)
                .industryWeight(Industry.FASHION, 1.3)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.2)
                .description("Gifts for parents")
                .dateRule(EventDateRules.fixed(Month.MAY, 8))
                .build());
        register(MarketEvent.builder()
                .id("MEMORIAL_DAY").name("Memorial Day")
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.NEGATIVE)
                .expectedChange(ExpectedChange.of(of(-20, -5), of(-25, -10), of(-10, -3)))
                .description("Day of remembrance with a slight dip")
                .dateRule(EventDateRules.fixed(Month.JUNE, 6))
                .build());
        register(quietHoliday("LIBERATION_DAY", "Liberation Day", Month.AUGUST, 15));
        register(MarketEvent.builder()
                .id("CHUSEOK").name("Chuseok")
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.MIXED)
                .expectedChange(ExpectedChange.of(of(-20, 70), of(-30, 60), of(-15, 20)))
                .leadDays(14).trailDays(3)
                .industryWeight(Industry.ECOMMERCE, 1.4)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.6)
                .industryWeight(Industry.FASHION, 1.2)
                .industryWeight(Industry.BEAUTY, 1.3)
                .description("Harvest festival gift season with large swings")
                .dateRule(EventDateRules.lunar(LunarHoliday.CHUSEOK))
                .build());
        register(quietHoliday("NATIONAL_FOUNDATION_DAY", "National Foundation Day", Month.OCTOBER, 3));
        register(quietHoliday("HANGUL_DAY", "Hangul Day", Month.OCTOBER, 9));
        register(MarketEvent.builder()
                .id("CHRISTMAS").name("Christmas")
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(20, 100), of(30, 120), of(10, 30)))
                .leadDays(21).trailDays(1)
                .industryWeight(Industry.ECOMMERCE, 1.5)
                .industryWeight(Industry.FASHION, 1.4)
                .industryWeight(Industry.BEAUTY, 1.3)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.2)
                .description("Peak of the year-end shopping season")
                .dateRule(EventDateRules.fixed(Month.DECEMBER, 25))
                .build());

        // Commercial events
        register(MarketEvent.builder()
                .id("VALENTINES_DAY").name("Valentine's Day")
                .category(EventCategory.COMMERCIAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(15, 50), of(20, 60), of(5, 20)))
                .leadDays(7)
                .industryWeight(Industry.BEAUTY, 1.4)
                .industryWeight(Industry.FASHION, 1.3)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.5)
                .description("Gifts between couples")
                .dateRule(EventDateRules.fixed(Month.FEBRUARY, 14))
                .build());
        register(MarketEvent.builder()
                .id("WHITE_DAY").name("White Day")
                .category(EventCategory.COMMERCIAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(15, 45), of(20, 55), of(5, 18)))
                .leadDays(7)
                .industryWeight(Industry.BEAUTY, 1.3)
                .industryWeight(Industry.FASHION, 1.2)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.4)
                .description("Return gifts a month after Valentine's Day")
                .dateRule(EventDateRules.fixed(Month.MARCH, 14))
                .build());
        register(MarketEvent.builder()
                .id("TEACHERS_DAY").name("Teachers' Day")
                .category(EventCategory.COMMERCIAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(5, 25), of(10, 35), of(3, 12)))
                .leadDays(5)
                .industryWeight(Industry.EDUCATION, 1.5)
                .industryWeight(Industry.BEAUTY, 1.2)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.2)
                .description("Gifts for teachers")
                .dateRule(EventDateRules.fixed(Month.MAY, 15))
                .build());
        register(MarketEvent.builder()
                .id("PEPERO_DAY").name("Pepero Day")
                .category(EventCategory.COMMERCIAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(10, 35), of(15, 45), of(5, 15)))
                .leadDays(5)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.8)
                .industryWeight(Industry.ECOMMERCE, 1.2)
                .description("Snack gifting on November 11")
                .dateRule(EventDateRules.fixed(Month.NOVEMBER, 11))
                .build());
        register(MarketEvent.builder()
                .id("SINGLES_DAY").name("Singles' Day")
                .category(EventCategory.COMMERCIAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(20, 70), of(30, 100), of(10, 30)))
                .leadDays(3).trailDays(1)
                .industryWeight(Industry.ECOMMERCE, 1.5)
                .industryWeight(Industry.FASHION, 1.3)
                .industryWeight(Industry.BEAUTY, 1.4)
                .description("11.11 online shopping event")
                .dateRule(EventDateRules.fixed(Month.NOVEMBER, 11))
                .build());
        register(MarketEvent.builder()
                .id("BLACK_FRIDAY").name("Black Friday")
                .category(EventCategory.COMMERCIAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(30, 100), of(40, 150), of(15, 40)))
                .leadDays(3).trailDays(3)
                .industryWeight(Industry.ECOMMERCE, 1.6)
                .industryWeight(Industry.FASHION, 1.5)
                .industryWeight(Industry.BEAUTY, 1.3)
                .description("Day-after-Thanksgiving shopping season")
                .dateRule(EventDateRules.nthWeekday(Month.NOVEMBER, 4, DayOfWeek.THURSDAY, 1))
                .build());
        register(MarketEvent.builder()
                .id("CYBER_MONDAY").name("Cyber Monday")
                .category(EventCategory.COMMERCIAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(25, 80), of(35, 120), of(12, 35)))
                .trailDays(1)
                .industryWeight(Industry.ECOMMERCE, 1.7)
                .industryWeight(Industry.SAAS, 1.3)
                .description("Online shopping peak the Monday after Black Friday")
                .dateRule(EventDateRules.nthWeekday(Month.NOVEMBER, 4, DayOfWeek.THURSDAY, 4))
                .build());

        // Seasonal windows
        register(MarketEvent.builder()
                .id("YEAR_END_SHOPPING").name("Year-end shopping season")
                .category(EventCategory.SEASONAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(20, 80), of(25, 100), of(10, 25)))
                .industryWeight(Industry.ECOMMERCE, 1.4)
                .industryWeight(Industry.FASHION, 1.3)
                .industryWeight(Industry.BEAUTY, 1.2)
                .description("December shopping season")
                .dateRule(EventDateRules.months(Month.DECEMBER, Month.DECEMBER))
                .build());
        register(MarketEvent.builder()
                .id("SUMMER_VACATION").name("Summer vacation season")
                .category(EventCategory.SEASONAL).impactType(ImpactType.MIXED)
                .expectedChange(ExpectedChange.of(of(-20, 40), of(-25, 50), of(-10, 15)))
                .industryWeight(Industry.FASHION, 1.3)
                .industryWeight(Industry.BEAUTY, 1.2)
                .industryWeight(Industry.FOOD_BEVERAGE, 1.1)
                .description("July and August vacation season")
                .dateRule(EventDateRules.months(Month.JULY, Month.AUGUST))
                .build());
        register(MarketEvent.builder()
                .id("BACK_TO_SCHOOL").name("Back-to-school season")
                .category(EventCategory.SEASONAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(10, 40), of(15, 50), of(5, 15)))
                .industryWeight(Industry.EDUCATION, 1.6)
                .industryWeight(Industry.FASHION, 1.3)
                .industryWeight(Industry.ECOMMERCE, 1.2)
                .description("February and March new school term")
                .dateRule(EventDateRules.months(Month.FEBRUARY, Month.MARCH))
                .build());
        register(MarketEvent.builder()
                .id("YEAR_END_TAX").name("Year-end tax settlement season")
                .category(EventCategory.SEASONAL).impactType(ImpactType.POSITIVE)
                .expectedChange(ExpectedChange.of(of(5, 30), of(10, 40), of(3, 12)))
                .industryWeight(Industry.SAAS, 1.4)
                .industryWeight(Industry.EDUCATION, 1.3)
                .description("January tax settlement season")
                .dateRule(EventDateRules.months(Month.JANUARY, Month.JANUARY))
                .build());
    }

    private MarketEventCatalog() {}

    public static List<MarketEvent> all() {
        return List.copyOf(EVENTS.values());
    }

    public static Optional<MarketEvent> byId(String id) {
        return Optional.ofNullable(EVENTS.get(id));
    }

    private static MarketEvent quietHoliday(String id, String name, Month month, int day) {
        return MarketEvent.builder()
                .id(id).name(name)
                .category(EventCategory.PUBLIC_HOLIDAY).impactType(ImpactType.NEGATIVE)
                .expectedChange(ExpectedChange.of(of(-15, -5), of(-20, -5), of(-10, -2)))
                .description("Public holiday with a general dip")
                .dateRule(EventDateRules.fixed(month, day))
                .build();
    }

    private static void register(MarketEvent event) {
        EVENTS.put(event.getId(), event);
    }
}
