package io.github.riemr.availability.application.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Entry point for booking and roster subsystems to drop stale availability.
 * Callers describe what changed and never build cache keys themselves.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AvailabilityCacheInvalidator {

    private final AvailabilityCache cache;

    /** A booking was created, moved or cancelled on {@code date}. */
    public int bookingChanged(LocalDate date) {
        int removed = invalidateDates(Set.of(date));
        log.info("Booking change on {} invalidated {} cached availability entries", date, removed);
        return removed;
    }

    /**
     * A driver's availability changed for the given dates.
     * An empty collection means the weekly pattern changed: every date is affected.
     */
    public int driverAvailabilityChanged(long driverId, Collection<LocalDate> dates) {
        int removed = (dates == null || dates.isEmpty()) ? invalidateAll() : invalidateDates(dates);
        log.info("Driver {} availability change invalidated {} cached availability entries", driverId, removed);
        return removed;
    }

    /** Same contract as {@link #driverAvailabilityChanged(long, Collection)}. */
    public int moverAvailabilityChanged(long moverId, Collection<LocalDate> dates) {
        int removed = (dates == null || dates.isEmpty()) ? invalidateAll() : invalidateDates(dates);
        log.info("Mover {} availability change invalidated {} cached availability entries", moverId, removed);
        return removed;
    }

    public int invalidateAll() {
        return cache.deletePattern(AvailabilityCacheKeys.ALL);
    }

    private int invalidateDates(Collection<LocalDate> dates) {
        int removed = 0;
        Set<YearMonth> months = new LinkedHashSet<>();
        for (LocalDate date : dates) {
            removed += cache.deletePattern(AvailabilityCacheKeys.dailyPattern(date));
            months.add(YearMonth.from(date));
        }
        for (YearMonth month : months) {
            removed += cache.deletePattern(AvailabilityCacheKeys.monthlyPattern(month));
        }
        return removed;
    }
}
