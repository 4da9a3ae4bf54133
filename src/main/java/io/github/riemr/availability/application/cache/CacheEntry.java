package io.github.riemr.availability.application.cache;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/** Immutable once written; a set on the same key replaces the entry. */
@Value
class CacheEntry {
    String key;
    Object data;
    Instant writtenAt;
    Duration ttl;
    /** Tie-breaker for entries written at the same instant. */
    long writeSequence;

    boolean isExpired(Instant now) {
        return !now.isBefore(writtenAt.plus(ttl));
    }
}
