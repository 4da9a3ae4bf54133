package io.github.riemr.availability.domain.model;

import lombok.Value;

import java.time.Instant;

/** A committed appointment occupying a mover or driver. */
@Value
public class BookingConflict {
    long resourceId;
    long appointmentId;
    Instant serviceStart;
    Instant serviceEnd;

    public Instant effectiveBlockedStart(JobTiming timing) {
        return timing.blockedStart(serviceStart);
    }

    public Instant effectiveBlockedEnd(JobTiming timing) {
        return timing.blockedEnd(serviceEnd);
    }
}
