package io.github.riemr.availability.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class BlockedDateRow {
    private Long userId;
    /** "mover" or "driver" */
    private String userType;
}
