package io.github.riemr.availability.infrastructure.persistence.entity;

import lombok.Data;

import java.util.Date;

@Data
public class ExternalTaskRow {
    private Long driverId;
    private Long appointmentId;
    private Date appointmentTime;
}
