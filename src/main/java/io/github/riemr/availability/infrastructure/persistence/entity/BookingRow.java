package io.github.riemr.availability.infrastructure.persistence.entity;

import lombok.Data;

import java.util.Date;

@Data
public class BookingRow {
    private Long resourceId;
    private Long appointmentId;
    private Date bookingDate;
    private Date endDate;
}
