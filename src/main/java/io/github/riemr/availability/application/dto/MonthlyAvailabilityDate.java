package io.github.riemr.availability.application.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.riemr.availability.domain.model.AvailabilityLevel;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonthlyAvailabilityDate {
    LocalDate date;
    boolean hasAvailability;
    /** Absent when the day has no availability. */
    AvailabilityLevel availabilityLevel;
    /** Absent for past days. */
    ResourceCounts resourceCounts;
}
