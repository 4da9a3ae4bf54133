package io.github.riemr.availability.domain.model;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalTime;

/** One weekly availability range, e.g. Monday 09:00-17:00. */
@Value
public class AvailabilityWindow {
    DayOfWeek dayOfWeek;
    LocalTime start;
    LocalTime end;

    public boolean contains(LocalTime from, LocalTime to) {
        return !from.isBefore(start) && !to.isAfter(end);
    }
}
