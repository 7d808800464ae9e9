package com.netra.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of probing a single dependency.
 *
 * @param service        service name (e.g., "postgres", "redis", "clickhouse")
 * @param status         classified health status
 * @param connected      whether a connection to the dependency was established
 * @param responseTimeMs measured round-trip time in milliseconds, or null when no answer was received
 * @param error          sanitized error message, or null when the probe did not fail
 * @param details        additional diagnostic fields (version, warning, exception_type, ...)
 * @param checkedAt      when the probe completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceHealthRecord(
        @JsonProperty("service") String service,
        @JsonProperty("status") HealthStatus status,
        @JsonProperty("connected") boolean connected,
        @JsonProperty("response_time_ms") Double responseTimeMs,
        @JsonProperty("error") String error,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("checked_at") Instant checkedAt
) {

    public ServiceHealthRecord {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (checkedAt == null) {
            throw new IllegalArgumentException("checkedAt must not be null");
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /** Creates a healthy, connected record. */
    public static ServiceHealthRecord healthy(String service, double responseTimeMs,
                                              Map<String, Object> details, Instant checkedAt) {
        return new ServiceHealthRecord(service, HealthStatus.HEALTHY, true, responseTimeMs, null, details, checkedAt);
    }

    /** Creates a degraded, connected record. */
    public static ServiceHealthRecord degraded(String service, double responseTimeMs,
                                               Map<String, Object> details, Instant checkedAt) {
        return new ServiceHealthRecord(service, HealthStatus.DEGRADED, true, responseTimeMs, null, details, checkedAt);
    }

    /** Creates a failed, disconnected record carrying an already sanitized error. */
    public static ServiceHealthRecord failed(String service, String error,
                                             Map<String, Object> details, Instant checkedAt) {
        return new ServiceHealthRecord(service, HealthStatus.FAILED, false, null, error, details, checkedAt);
    }

    /** Creates a record for an optional dependency without connection settings. */
    public static ServiceHealthRecord notConfigured(String service, String reason, Instant checkedAt) {
        return new ServiceHealthRecord(service, HealthStatus.NOT_CONFIGURED, false, null, null,
                Map.of("reason", reason), checkedAt);
    }

    /**
     * Returns a copy of this record with one detail added or replaced.
     */
    public ServiceHealthRecord withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new ServiceHealthRecord(service, status, connected, responseTimeMs, error, merged, checkedAt);
    }
}
