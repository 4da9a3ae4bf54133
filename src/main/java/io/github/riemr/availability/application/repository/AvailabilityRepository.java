package io.github.riemr.availability.application.repository;

import io.github.riemr.availability.application.dto.DateAvailabilityData;
import io.github.riemr.availability.application.dto.WeeklyResourceCounts;
import io.github.riemr.availability.domain.model.PlanType;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;

/**
 * Read-only view of rosters, bookings and external tasks.
 * Implementations throw {@link io.github.riemr.availability.application.exception.UpstreamDataException}
 * when data cannot be read or is malformed.
 */
public interface AvailabilityRepository {

    /** Movers are only counted for plans that need one. */
    WeeklyResourceCounts countResourcesByDayOfWeek(Set<DayOfWeek> daysOfWeek, PlanType planType);

    /** @param excludeAppointmentId bookings and tasks of this appointment are left out; may be null */
    DateAvailabilityData loadDateAvailability(LocalDate date, PlanType planType, Long excludeAppointmentId);
}
