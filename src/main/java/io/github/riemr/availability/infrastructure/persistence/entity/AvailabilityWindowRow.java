package io.github.riemr.availability.infrastructure.persistence.entity;

import lombok.Data;

/** moving_partner_availability / driver_availability row joined with its active owner. */
@Data
public class AvailabilityWindowRow {
    private Long resourceId;
    private String dayOfWeek;
    private String startTime;
    private String endTime;
}
