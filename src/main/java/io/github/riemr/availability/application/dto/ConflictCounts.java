package io.github.riemr.availability.application.dto;

import lombok.Value;

@Value
public class ConflictCounts {
    int blockedDates;
    int existingBookings;
    int onfleetTasks;

    public static ConflictCounts none() {
        return new ConflictCounts(0, 0, 0);
    }
}
