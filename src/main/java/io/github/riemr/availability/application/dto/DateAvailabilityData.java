package io.github.riemr.availability.application.dto;

import io.github.riemr.availability.domain.model.BookingConflict;
import io.github.riemr.availability.domain.model.ExternalTaskConflict;
import io.github.riemr.availability.domain.model.Resource;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the daily view needs for one date, read in one batch.
 * Rosters exclude resources blocked for the whole date; those ids are kept for reporting.
 */
@Value
@Builder
public class DateAvailabilityData {
    List<Resource> movers;
    List<Resource> drivers;
    Set<Long> blockedMoverIds;
    Set<Long> blockedDriverIds;
    Map<Long, List<BookingConflict>> moverBookings;
    Map<Long, List<BookingConflict>> driverBookings;
    Map<Long, List<ExternalTaskConflict>> driverTasks;

    public List<BookingConflict> bookingsOf(Resource resource) {
        Map<Long, List<BookingConflict>> source = switch (resource.getType()) {
            case MOVER -> moverBookings;
            case DRIVER -> driverBookings;
        };
        return source.getOrDefault(resource.getId(), List.of());
    }

    public List<ExternalTaskConflict> tasksOf(Resource resource) {
        return driverTasks.getOrDefault(resource.getId(), List.of());
    }
}
