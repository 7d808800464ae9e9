package com.netra.health;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health status of a single dependency.
 * <p>
 * The wire values are a stable contract: dashboards and external tooling match on the
 * literal strings, so constants may be added but never renamed.
 */
public enum HealthStatus {

    /** The dependency answered within its latency budget. */
    HEALTHY("healthy"),

    /** The dependency answered but is slow or close to a resource limit. */
    DEGRADED("degraded"),

    /** The dependency could not be reached, timed out, or is required but missing. */
    FAILED("failed"),

    /** The dependency is optional and no connection settings were supplied. */
    NOT_CONFIGURED("not_configured");

    private final String wireValue;

    HealthStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Returns the literal value exposed to health consumers (e.g. {@code "not_configured"}).
     */
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Resolves a status from its wire value.
     *
     * @param value wire value such as {@code "healthy"}
     * @return the matching status
     * @throws IllegalArgumentException if the value is not part of the vocabulary
     */
    public static HealthStatus fromWireValue(String value) {
        for (HealthStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + value);
    }
}
