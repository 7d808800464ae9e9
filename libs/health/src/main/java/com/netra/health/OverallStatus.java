package com.netra.health;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * System-wide status derived from the individual dependency statuses.
 */
public enum OverallStatus {

    /** Every dependency is healthy or intentionally not configured. */
    HEALTHY("healthy"),

    /** A non-critical dependency failed, or some dependency is degraded. */
    DEGRADED("degraded"),

    /** A critical dependency failed; the system cannot serve requests. */
    FAILED("failed"),

    /** No aggregation rule matched. Unreachable while {@link HealthStatus} stays closed. */
    UNKNOWN("unknown");

    private final String wireValue;

    OverallStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
