package com.netra.health;

import com.netra.health.aggregation.CriticalityFlags;
import com.netra.health.cache.HealthCache;
import com.netra.health.probe.AnalyticsStoreProbe;
import com.netra.health.probe.CacheStoreProbe;
import com.netra.health.probe.RelationalStoreProbe;

import java.time.Duration;

/**
 * Tuning of a {@link HealthCheckManager}.
 *
 * @param environment       deployment environment stamped on snapshots
 * @param cacheTtl          how long probe results are served from cache
 * @param relationalTimeout bound for the relational-store probe
 * @param cacheTimeout      bound for the cache-store probe
 * @param analyticsTimeout  bound for the analytics-store probe
 * @param criticality       which optional dependencies are required
 */
public record HealthCheckSettings(
        String environment,
        Duration cacheTtl,
        Duration relationalTimeout,
        Duration cacheTimeout,
        Duration analyticsTimeout,
        CriticalityFlags criticality
) {

    /**
     * Compact constructor that fills in defaults for missing values.
     */
    public HealthCheckSettings {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        cacheTtl = positiveOr(cacheTtl, HealthCache.DEFAULT_TTL);
        relationalTimeout = positiveOr(relationalTimeout, RelationalStoreProbe.DEFAULT_TIMEOUT);
        cacheTimeout = positiveOr(cacheTimeout, CacheStoreProbe.DEFAULT_TIMEOUT);
        analyticsTimeout = positiveOr(analyticsTimeout, AnalyticsStoreProbe.DEFAULT_TIMEOUT);
        if (criticality == null) {
            criticality = CriticalityFlags.noneRequired();
        }
    }

    /** Settings with every default and the given environment. */
    public static HealthCheckSettings defaults(String environment) {
        return new HealthCheckSettings(environment, null, null, null, null, null);
    }

    /** Returns a copy with different criticality flags. */
    public HealthCheckSettings withCriticality(CriticalityFlags flags) {
        return new HealthCheckSettings(environment, cacheTtl, relationalTimeout, cacheTimeout, analyticsTimeout, flags);
    }

    /**
     * Returns the probe bound for the given dependency.
     */
    public Duration timeoutFor(DependencyKind kind) {
        return switch (kind) {
            case RELATIONAL -> relationalTimeout;
            case CACHE -> cacheTimeout;
            case ANALYTICS -> analyticsTimeout;
        };
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
