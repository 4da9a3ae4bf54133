package io.github.riemr.availability.application.util;

import io.github.riemr.availability.application.dto.CandidateSlot;
import io.github.riemr.availability.domain.model.AvailabilityLevel;
import io.github.riemr.availability.domain.model.BookingConflict;
import io.github.riemr.availability.domain.model.ExternalTaskConflict;
import io.github.riemr.availability.domain.model.JobTiming;
import io.github.riemr.availability.domain.model.Resource;

import java.time.DayOfWeek;
import java.util.Collection;

public final class ResourceConflictEvaluator {
    static final double HIGH_RATIO = 3.0;
    static final double MEDIUM_RATIO = 1.5;

    private ResourceConflictEvaluator() {}

    public enum SlotConflict {
        NONE,
        OUTSIDE_AVAILABILITY,
        BOOKING,
        EXTERNAL_TASK
    }

    /**
     * First reason the resource cannot take the slot, or {@link SlotConflict#NONE}.
     * Bookings and external tasks not belonging to the resource are ignored.
     */
    public static SlotConflict evaluate(Resource resource,
                                        DayOfWeek dayOfWeek,
                                        CandidateSlot slot,
                                        Collection<BookingConflict> bookings,
                                        Collection<ExternalTaskConflict> externalTasks,
                                        JobTiming timing) {
        if (!resource.getAvailability().covers(dayOfWeek, slot.getStartTime(), slot.getEndTime())) {
            return SlotConflict.OUTSIDE_AVAILABILITY;
        }
        for (BookingConflict b : bookings) {
            if (b.getResourceId() != resource.getId()) continue;
            if (SlotTimeUtils.intervalsOverlap(slot.getSlotStart(), slot.getSlotEnd(),
                    b.effectiveBlockedStart(timing), b.effectiveBlockedEnd(timing))) {
                return SlotConflict.BOOKING;
            }
        }
        for (ExternalTaskConflict t : externalTasks) {
            if (t.getDriverId() != resource.getId()) continue;
            if (SlotTimeUtils.intervalsOverlap(slot.getSlotStart(), slot.getSlotEnd(),
                    t.getWindowStart(), t.getWindowEnd())) {
                return SlotConflict.EXTERNAL_TASK;
            }
        }
        return SlotConflict.NONE;
    }

    public static boolean isResourceFreeInWindow(Resource resource,
                                                 DayOfWeek dayOfWeek,
                                                 CandidateSlot slot,
                                                 Collection<BookingConflict> bookings,
                                                 Collection<ExternalTaskConflict> externalTasks,
                                                 JobTiming timing) {
        return evaluate(resource, dayOfWeek, slot, bookings, externalTasks, timing) == SlotConflict.NONE;
    }

    /**
     * Tier from the smallest slack ratio (available / required) over the resource types that are
     * actually required. Non-decreasing in both available counts.
     * When nothing is required, any free resource counts as HIGH and none as LOW.
     */
    public static AvailabilityLevel determineAvailabilityLevel(int availableMovers,
                                                               int availableDrivers,
                                                               int requiredMovers,
                                                               int requiredDrivers) {
        double minRatio = Double.POSITIVE_INFINITY;
        if (requiredMovers > 0) {
            minRatio = Math.min(minRatio, (double) availableMovers / requiredMovers);
        }
        if (requiredDrivers > 0) {
            minRatio = Math.min(minRatio, (double) availableDrivers / requiredDrivers);
        }
        if (Double.isInfinite(minRatio)) {
            return availableMovers + availableDrivers > 0 ? AvailabilityLevel.HIGH : AvailabilityLevel.LOW;
        }

        if (minRatio >= HIGH_RATIO) return AvailabilityLevel.HIGH;
        if (minRatio >= MEDIUM_RATIO) return AvailabilityLevel.MEDIUM;
        return AvailabilityLevel.LOW;
    }
}
