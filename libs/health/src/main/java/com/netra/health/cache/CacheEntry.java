package com.netra.health.cache;

import com.netra.health.ServiceHealthRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached probe result and the time it was stored.
 *
 * @param record   the cached health record
 * @param storedAt when the record was written to the cache
 */
public record CacheEntry(ServiceHealthRecord record, Instant storedAt) {

    public CacheEntry {
        if (record == null || storedAt == null) {
            throw new IllegalArgumentException("record and storedAt must not be null");
        }
    }

    /**
     * Returns true while {@code now - storedAt} is strictly less than {@code ttl}.
     */
    public boolean isValidAt(Instant now, Duration ttl) {
        return Duration.between(storedAt, now).compareTo(ttl) < 0;
    }
}
