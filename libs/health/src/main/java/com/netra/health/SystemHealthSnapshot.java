package com.netra.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time health of the whole system.
 *
 * @param overallStatus status derived by the aggregation rules
 * @param services      per-service records keyed by service name, in {@link DependencyKind} order
 * @param checkedAt     when the snapshot was assembled
 * @param environment   deployment environment tag (e.g., "production", "staging")
 */
public record SystemHealthSnapshot(
        @JsonProperty("overall_status") OverallStatus overallStatus,
        @JsonProperty("services") Map<String, ServiceHealthRecord> services,
        @JsonProperty("checked_at") Instant checkedAt,
        @JsonProperty("environment") String environment
) {

    public SystemHealthSnapshot {
        if (overallStatus == null) {
            throw new IllegalArgumentException("overallStatus must not be null");
        }
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    /**
     * Returns the record for the given dependency, or null if it is not part of this snapshot.
     */
    public ServiceHealthRecord service(DependencyKind kind) {
        return services.get(kind.serviceName());
    }
}
