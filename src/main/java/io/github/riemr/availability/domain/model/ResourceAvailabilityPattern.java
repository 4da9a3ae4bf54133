package io.github.riemr.availability.domain.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weekly availability of a mover or driver: day of week -> ordered time ranges.
 * Read-only here; the roster owner maintains it.
 */
public final class ResourceAvailabilityPattern {
    private final Map<DayOfWeek, List<AvailabilityWindow>> windowsByDay;

    private ResourceAvailabilityPattern(Map<DayOfWeek, List<AvailabilityWindow>> windowsByDay) {
        this.windowsByDay = windowsByDay;
    }

    public static ResourceAvailabilityPattern of(Collection<AvailabilityWindow> windows) {
        Map<DayOfWeek, List<AvailabilityWindow>> byDay = new EnumMap<>(DayOfWeek.class);
        for (AvailabilityWindow w : windows) {
            byDay.computeIfAbsent(w.getDayOfWeek(), d -> new ArrayList<>()).add(w);
        }
        byDay.replaceAll((day, list) -> list.stream()
                .sorted(Comparator.comparing(AvailabilityWindow::getStart))
                .toList());
        return new ResourceAvailabilityPattern(byDay);
    }

    public List<AvailabilityWindow> windowsOn(DayOfWeek day) {
        return windowsByDay.getOrDefault(day, List.of());
    }

    /** True when a single range of that day fully contains [from, to). */
    public boolean covers(DayOfWeek day, LocalTime from, LocalTime to) {
        return windowsOn(day).stream().anyMatch(w -> w.contains(from, to));
    }

    @Override
    public String toString() {
        return "ResourceAvailabilityPattern" + windowsByDay;
    }
}
