package io.github.riemr.availability.application.dto;

import io.github.riemr.availability.domain.model.AvailabilityLevel;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TimeSlotAvailability {
    /** HH:mm */
    String startTime;
    String endTime;
    /** e.g. 9am-10am */
    String display;
    boolean available;
    AvailabilityLevel availabilityLevel;
    ResourceCounts resourceCounts;
}
