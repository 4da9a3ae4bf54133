package io.github.riemr.availability.domain.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed job timing constants. A job blocks its resource for
 * [serviceStart - bufferBefore, serviceEnd + bufferAfter).
 */
@Value
public class JobTiming {
    Duration bufferBefore;
    Duration bufferAfter;
    Duration serviceDuration;

    public static JobTiming ofMinutes(long before, long after, long service) {
        return new JobTiming(Duration.ofMinutes(before), Duration.ofMinutes(after), Duration.ofMinutes(service));
    }

    public Instant blockedStart(Instant serviceStart) {
        return serviceStart.minus(bufferBefore);
    }

    public Instant blockedEnd(Instant serviceEnd) {
        return serviceEnd.plus(bufferAfter);
    }

    /** Widest distance a job starting outside a day can reach into it. */
    public Duration reach() {
        return bufferBefore.plus(serviceDuration).plus(bufferAfter);
    }
}
