package io.github.riemr.availability.application.dto;

import lombok.Value;

import java.time.DayOfWeek;
import java.util.Map;

/** Active movers / drivers with a (non-blocked) availability range on each weekday. */
@Value
public class WeeklyResourceCounts {
    Map<DayOfWeek, Integer> moversByDay;
    Map<DayOfWeek, Integer> driversByDay;

    public int movers(DayOfWeek day) {
        return moversByDay.getOrDefault(day, 0);
    }

    public int drivers(DayOfWeek day) {
        return driversByDay.getOrDefault(day, 0);
    }

    public int totalMovers() {
        return moversByDay.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalDrivers() {
        return driversByDay.values().stream().mapToInt(Integer::intValue).sum();
    }
}
