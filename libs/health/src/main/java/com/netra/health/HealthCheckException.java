package com.netra.health;

/**
 * Thrown when the health engine itself misbehaves, for example a probe that completes
 * exceptionally instead of returning a record.
 * <p>
 * This is never used for an unhealthy dependency; those are reported as {@code failed}
 * records. Callers should map it to an internal error.
 */
public class HealthCheckException extends RuntimeException {

    public HealthCheckException(String message) {
        super(message);
    }

    public HealthCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
