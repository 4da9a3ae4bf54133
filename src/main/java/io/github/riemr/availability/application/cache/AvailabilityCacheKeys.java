package io.github.riemr.availability.application.cache;

import io.github.riemr.availability.application.dto.DailyAvailabilityQuery;
import io.github.riemr.availability.application.dto.MonthlyAvailabilityQuery;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Cache key layout: {@code availability:<view>:<name>:<value>|<name>:<value>...}
 * with parameters sorted by name. Used by the availability service to store results and by
 * {@link AvailabilityCacheInvalidator} to drop them.
 */
public final class AvailabilityCacheKeys {
    static final String PREFIX = "availability:";
    static final String MONTHLY = "monthly";
    static final String DAILY = "daily";
    static final String ALL = PREFIX + "*";

    private AvailabilityCacheKeys() {}

    public static String monthly(MonthlyAvailabilityQuery q) {
        Map<String, Object> params = new TreeMap<>();
        params.put("year", q.getYear());
        params.put("month", q.getMonth());
        params.put("planType", q.getPlanType());
        params.put("unitCount", q.getUnitCount());
        return key(MONTHLY, params);
    }

    public static String daily(DailyAvailabilityQuery q) {
        Map<String, Object> params = new TreeMap<>();
        params.put("date", q.getDate());
        params.put("planType", q.getPlanType());
        params.put("unitCount", q.getUnitCount());
        if (q.getExcludeAppointmentId() != null) {
            params.put("excludeAppointmentId", q.getExcludeAppointmentId());
        }
        return key(DAILY, params);
    }

    static String dailyPattern(LocalDate date) {
        return PREFIX + DAILY + ":*date:" + date + "*";
    }

    /** "month:1|" cannot match month 10..12 thanks to the separator. */
    static String monthlyPattern(YearMonth month) {
        return PREFIX + MONTHLY + ":*month:" + month.getMonthValue() + "|*year:" + month.getYear() + "*";
    }

    private static String key(String view, Map<String, Object> sortedParams) {
        return PREFIX + view + ":" + sortedParams.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining("|"));
    }
}
