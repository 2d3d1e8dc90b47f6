package com.strollie.planner.engine.resilience;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounded, time-limited store of successful call results, shared by every resilient call
 * it is injected into.
 * <p>
 * Reads and writes for different keys never block each other. Two callers missing the same key
 * may both fetch and store; the last write wins. Size-bound eviction and expiry purging are
 * maintenance only: a read re-checks {@link CacheEntry#expiresAt()} itself.
 */
@Slf4j
public class ResultCache {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    public static final int DEFAULT_MAX_ENTRIES = 200;

    private final Cache<String, CacheEntry> entries;
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public ResultCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    public ResultCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got " + maxEntries);
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public Optional<CacheEntry> lookup(String key) {
        CacheEntry entry = entries.getIfPresent(key);

        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }

        if (entry.isExpiredAt(clock.instant())) {
            entries.asMap().remove(key, entry);
            misses.increment();
            return Optional.empty();
        }

        hits.increment();
        return Optional.of(entry);
    }

    public CacheEntry put(String key, Object value) {
        CacheEntry entry = new CacheEntry(key, value, clock.instant().plus(ttl));
        entries.put(key, entry);
        return entry;
    }

    public void invalidate(String key) {
        entries.invalidate(key);
    }

    public void clear() {
        entries.invalidateAll();
        hits.reset();
        misses.reset();
        log.info("Result cache cleared");
    }

    /**
     * Runs pending eviction and expiry now instead of on the next access.
     */
    public void cleanUp() {
        entries.cleanUp();
    }

    public Duration ttl() {
        return ttl;
    }

    public CacheStats stats() {
        return new CacheStats(entries.estimatedSize(), maxEntries, hits.sum(), misses.sum());
    }

    /**
     * Stored result. Never edited after insertion; a fresh fetch replaces the whole entry.
     */
    public record CacheEntry(String key, Object value, Instant expiresAt) {
        public boolean isExpiredAt(Instant now) {
            return now.isAfter(expiresAt);
        }
    }

    public record CacheStats(long entries, int maxEntries, long hits, long misses) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0 : (double) hits / total;
        }
    }
}
