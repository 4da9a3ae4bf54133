package io.github.riemr.availability.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class DayOfWeekCountRow {
    private String dayOfWeek;
    private Integer resourceCount;
}
