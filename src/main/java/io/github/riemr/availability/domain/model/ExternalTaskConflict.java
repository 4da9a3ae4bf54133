package io.github.riemr.availability.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Window during which a driver is busy with a task of the external logistics system.
 * Checked independently of {@link BookingConflict}s.
 */
@Value
public class ExternalTaskConflict {
    long driverId;
    long appointmentId;
    Instant windowStart;
    Instant windowEnd;

    /** Task known only by its start: it blocks like a regular job of standard length. */
    public static ExternalTaskConflict startingAt(long driverId, long appointmentId, Instant taskStart, JobTiming timing) {
        return new ExternalTaskConflict(driverId, appointmentId,
                timing.blockedStart(taskStart),
                timing.blockedEnd(taskStart.plus(timing.getServiceDuration())));
    }
}
