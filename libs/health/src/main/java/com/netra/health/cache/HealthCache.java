package com.netra.health.cache;

import com.netra.health.ServiceHealthRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL-bounded memo of the latest health record per service.
 * <p>
 * The store time of each entry doubles as the service's last-check timestamp, so
 * {@link #clear()} removes both in one operation.
 */
public final class HealthCache {

    /** Default time-to-live for cached records (30 seconds). */
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    /**
     * Creates a cache with the default TTL and the system UTC clock.
     */
    public HealthCache() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    /**
     * Creates a cache with a custom TTL and clock.
     *
     * @param ttl   maximum age of a valid entry
     * @param clock time source used for storing and validating entries
     */
    public HealthCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached record for the service if present and not expired.
     */
    public Optional<ServiceHealthRecord> get(String service) {
        CacheEntry entry = entries.get(service);
        if (entry == null || !entry.isValidAt(clock.instant(), ttl)) {
            return Optional.empty();
        }
        return Optional.of(entry.record());
    }

    /**
     * Stores a record for the service, stamped with the current time.
     *
     * @return the previously cached record, if any (expired or not)
     */
    public Optional<ServiceHealthRecord> put(String service, ServiceHealthRecord record) {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        CacheEntry previous = entries.put(service, new CacheEntry(record, clock.instant()));
        return Optional.ofNullable(previous).map(CacheEntry::record);
    }

    /**
     * Returns true if the service has an entry younger than the TTL.
     */
    public boolean isValid(String service) {
        CacheEntry entry = entries.get(service);
        return entry != null && entry.isValidAt(clock.instant(), ttl);
    }

    /**
     * Returns when the service was last stored, regardless of expiry.
     */
    public Optional<Instant> lastCheckedAt(String service) {
        return Optional.ofNullable(entries.get(service)).map(CacheEntry::storedAt);
    }

    /**
     * Removes every entry and last-check timestamp. Idempotent.
     */
    public void clear() {
        entries.clear();
    }

    /**
     * Returns the number of stored entries, including expired ones.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the configured TTL.
     */
    public Duration ttl() {
        return ttl;
    }
}
