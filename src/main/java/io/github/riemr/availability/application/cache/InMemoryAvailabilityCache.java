package io.github.riemr.availability.application.cache;

import io.github.riemr.availability.application.dto.CacheEntryStats;
import io.github.riemr.availability.application.dto.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Process-local {@link AvailabilityCache}.
 * <ul>
 *   <li>Expired entries behave as absent on read and are also removed by a periodic sweep</li>
 *   <li>At capacity, inserting a new key first evicts the single entry with the oldest write time
 *       (write order, not access order)</li>
 * </ul>
 * The sweep runs only between {@link #start()} and {@link #stop()}.
 */
@Slf4j
public class InMemoryAvailabilityCache implements AvailabilityCache {

    private final Map<String, CacheEntry> store = new ConcurrentHashMap<>();
    private final AtomicLong writeSequence = new AtomicLong();
    private final Object writeLock = new Object();

    private final Clock clock;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Duration sweepInterval;

    private ScheduledExecutorService sweeper;

    public InMemoryAvailabilityCache(Clock clock, int maxSize, Duration defaultTtl, Duration sweepInterval) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        requirePositive(defaultTtl, "defaultTtl");
        requirePositive(sweepInterval, "sweepInterval");
        this.clock = clock;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.sweepInterval = sweepInterval;
    }

    /* === Lifecycle === */

    public synchronized void start() {
        if (sweeper != null) return;
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "availability-cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        long periodMs = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Availability cache sweep started (interval={}, maxSize={})", sweepInterval, maxSize);
    }

    public synchronized void stop() {
        if (sweeper == null) return;
        sweeper.shutdownNow();
        sweeper = null;
        log.info("Availability cache sweep stopped");
    }

    public synchronized boolean isSweepRunning() {
        return sweeper != null;
    }

    /* === Operations === */

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        CacheEntry entry = liveEntry(key);
        if (entry == null) return Optional.empty();
        if (!type.isInstance(entry.getData())) {
            log.warn("Cache entry {} holds {}, expected {}", key, entry.getData().getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.getData()));
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, null);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (key == null) throw new IllegalArgumentException("key is required");
        if (value == null) throw new IllegalArgumentException("value is required");
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        requirePositive(effectiveTtl, "ttl");

        synchronized (writeLock) {
            if (!store.containsKey(key) && store.size() >= maxSize) {
                evictOldest();
            }
            store.put(key, new CacheEntry(key, value, clock.instant(), effectiveTtl, writeSequence.incrementAndGet()));
        }
    }

    @Override
    public boolean delete(String key) {
        return store.remove(key) != null;
    }

    @Override
    public int deletePattern(String pattern) {
        Pattern regex = globToRegex(pattern);
        int removed = 0;
        for (String key : store.keySet()) {
            if (regex.matcher(key).matches() && store.remove(key) != null) {
                removed++;
            }
        }
        log.debug("deletePattern({}) removed {} entries", pattern, removed);
        return removed;
    }

    @Override
    public boolean has(String key) {
        return liveEntry(key) != null;
    }

    @Override
    public void clear() {
        store.clear();
    }

    @Override
    public CacheStats stats() {
        Instant now = clock.instant();
        List<CacheEntryStats> entries = store.values().stream()
                .sorted(Comparator.comparingLong(CacheEntry::getWriteSequence))
                .map(e -> new CacheEntryStats(e.getKey(),
                        Duration.between(e.getWrittenAt(), now).getSeconds(),
                        e.getTtl().getSeconds()))
                .toList();
        return new CacheStats(store.size(), maxSize, entries);
    }

    /** Removes all expired entries regardless of access. */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (CacheEntry entry : store.values()) {
            if (entry.isExpired(now) && store.remove(entry.getKey(), entry)) {
                removed++;
            }
        }
        return removed;
    }

    /* === Internals === */

    private CacheEntry liveEntry(String key) {
        CacheEntry entry = store.get(key);
        if (entry == null) return null;
        if (entry.isExpired(clock.instant())) {
            store.remove(key, entry);
            return null;
        }
        return entry;
    }

    private void evictOldest() {
        store.values().stream()
                .min(Comparator.comparing(CacheEntry::getWrittenAt)
                        .thenComparingLong(CacheEntry::getWriteSequence))
                .ifPresent(oldest -> {
                    store.remove(oldest.getKey(), oldest);
                    log.debug("Evicted oldest cache entry {}", oldest.getKey());
                });
    }

    private void sweepQuietly() {
        try {
            int removed = sweepExpired();
            if (removed > 0) {
                log.debug("Cache sweep removed {} expired entries", removed);
            }
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled task
            log.warn("Cache sweep failed: {}", e.getMessage(), e);
        }
    }

    static Pattern globToRegex(String glob) {
        if (glob == null) throw new IllegalArgumentException("pattern is required");
        StringBuilder sb = new StringBuilder();
        int from = 0;
        int star;
        while ((star = glob.indexOf('*', from)) >= 0) {
            if (star > from) sb.append(Pattern.quote(glob.substring(from, star)));
            sb.append(".*");
            from = star + 1;
        }
        if (from < glob.length()) sb.append(Pattern.quote(glob.substring(from)));
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }
}
