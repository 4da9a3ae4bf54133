package io.github.riemr.availability.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class DailyAvailabilityResponse {
    LocalDate date;
    List<TimeSlotAvailability> timeSlots;
    AvailabilityMetadata metadata;

    public DailyAvailabilityResponse markCacheHit() {
        return toBuilder().metadata(metadata.toBuilder().cacheHit(true).build()).build();
    }
}
