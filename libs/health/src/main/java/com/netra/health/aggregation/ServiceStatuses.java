package com.netra.health.aggregation;

import com.netra.health.HealthStatus;

import java.util.List;

/**
 * The three dependency statuses fed into aggregation.
 *
 * @param relational status of the relational store
 * @param cache      status of the cache store
 * @param analytics  status of the analytics store
 */
public record ServiceStatuses(HealthStatus relational, HealthStatus cache, HealthStatus analytics) {

    public ServiceStatuses {
        if (relational == null || cache == null || analytics == null) {
            throw new IllegalArgumentException("statuses must not be null");
        }
    }

    /** Returns all three statuses in relational, cache, analytics order. */
    public List<HealthStatus> all() {
        return List.of(relational, cache, analytics);
    }

    /** Returns true if any of the three statuses equals {@code status}. */
    public boolean any(HealthStatus status) {
        return relational == status || cache == status || analytics == status;
    }
}
