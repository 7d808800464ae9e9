package com.netra.healthservice.config;

import com.netra.health.HealthCheckSettings;
import com.netra.health.aggregation.CriticalityFlags;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the health engine, bound from {@code netra.health.*}.
 *
 * <pre>
 * netra:
 *   health:
 *     name: netra-backend
 *     environment: staging
 *     cache-ttl: 30s
 *     relational-timeout: 5s
 *     cache-timeout: 5s
 *     analytics-timeout: 10s
 *     startup-timeout: 30s
 *     fail-on-startup-failure: false
 *     probe-threads: 4
 * </pre>
 *
 * <p>Dependency connection settings ({@code POSTGRES_*}, {@code REDIS_*}, {@code CLICKHOUSE_*})
 * are read separately through {@link com.netra.health.config.HealthDependencies}.
 *
 * @param name service name used in logs. Required.
 * @param environment deployment environment (development, staging, production).
 * @param cacheTtl how long probe results are served from cache (default 30s).
 * @param relationalTimeout bound of the relational-store probe (default 5s).
 * @param cacheTimeout bound of the cache-store probe (default 5s).
 * @param analyticsTimeout bound of the analytics-store probe (default 10s).
 * @param startupTimeout deadline of the startup health check (default 30s).
 * @param failOnStartupFailure abort startup when the overall status is failed.
 * @param probeThreads threads running blocking client calls (default 4); must be positive when set.
 */
@ConfigurationProperties(prefix = "netra.health")
@Validated
public record HealthServiceProperties(
        @NotBlank String name,
        String environment,
        Duration cacheTtl,
        Duration relationalTimeout,
        Duration cacheTimeout,
        Duration analyticsTimeout,
        Duration startupTimeout,
        boolean failOnStartupFailure,
        @Positive Integer probeThreads) {

    /** Default deadline of the startup health check. */
    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(30);

    /** Default number of probe threads when none is configured. */
    public static final int DEFAULT_PROBE_THREADS = 4;

    /**
     * Compact constructor; applies defaults for optional fields before Bean Validation runs.
     */
    public HealthServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (startupTimeout == null || startupTimeout.isNegative() || startupTimeout.isZero()) {
            startupTimeout = DEFAULT_STARTUP_TIMEOUT;
        }
        if (probeThreads == null) {
            probeThreads = DEFAULT_PROBE_THREADS;
        }
    }

    /**
     * Converts to engine settings. Durations left unset fall back to the engine defaults.
     */
    public HealthCheckSettings toSettings(CriticalityFlags criticality) {
        return new HealthCheckSettings(
                environment, cacheTtl, relationalTimeout, cacheTimeout, analyticsTimeout, criticality);
    }
}
