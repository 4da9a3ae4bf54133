package io.github.riemr.availability.application.cache;

import io.github.riemr.availability.application.dto.CacheStats;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL key-value store for computed availability responses.
 * <p>
 * The in-process implementation is local to one JVM: several running instances hold
 * independent caches and may briefly disagree. A deployment with more than one instance
 * plugs a shared store in behind this interface.
 */
public interface AvailabilityCache {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value);

    /** @param ttl overrides the default time to live; null means default */
    void set(String key, Object value, Duration ttl);

    boolean delete(String key);

    /**
     * Deletes every key matching {@code pattern}, where {@code *} matches any substring.
     * @return number of deleted entries
     */
    int deletePattern(String pattern);

    boolean has(String key);

    void clear();

    CacheStats stats();
}
