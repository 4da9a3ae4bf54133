package io.github.riemr.availability.domain.model;

import lombok.Value;

import java.time.ZoneId;

/**
 * Operating hours candidate slots are generated from.
 * Slot instants are resolved in {@code zone}; hours are local to it.
 */
@Value
public class BusinessHours {
    int startHour;
    int endHour;
    int slotMinutes;
    ZoneId zone;

    public BusinessHours(int startHour, int endHour, int slotMinutes, ZoneId zone) {
        if (startHour < 0 || endHour > 23 || startHour >= endHour) {
            throw new IllegalArgumentException("business hours must satisfy 0 <= start < end <= 23: " + startHour + "-" + endHour);
        }
        if (slotMinutes <= 0 || slotMinutes > (endHour - startHour) * 60) {
            throw new IllegalArgumentException("slotMinutes out of range: " + slotMinutes);
        }
        this.startHour = startHour;
        this.endHour = endHour;
        this.slotMinutes = slotMinutes;
        this.zone = zone;
    }
}
