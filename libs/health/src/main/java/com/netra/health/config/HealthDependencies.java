package com.netra.health.config;

import com.netra.health.aggregation.CriticalityFlags;

/**
 * Connection settings of the three probed dependencies.
 *
 * @param relational relational store settings ({@code POSTGRES_*})
 * @param cache      cache store settings ({@code REDIS_*})
 * @param analytics  analytics store settings ({@code CLICKHOUSE_*})
 */
public record HealthDependencies(
        DependencySettings relational,
        DependencySettings cache,
        DependencySettings analytics
) {

    public static final String RELATIONAL_PREFIX = "POSTGRES";
    public static final String CACHE_PREFIX = "REDIS";
    public static final String ANALYTICS_PREFIX = "CLICKHOUSE";

    /** Environment in which the analytics store is always required. */
    public static final String PRODUCTION = "production";

    public HealthDependencies {
        if (relational == null || cache == null || analytics == null) {
            throw new IllegalArgumentException("dependency settings must not be null");
        }
    }

    /**
     * Reads all three dependencies from the source. In {@value #PRODUCTION} the analytics
     * store is required regardless of {@code CLICKHOUSE_REQUIRED}.
     *
     * @throws IllegalArgumentException if any value is malformed
     */
    public static HealthDependencies load(ConfigurationSource source, String environment) {
        DependencySettings analytics = DependencySettings.from(source, ANALYTICS_PREFIX);
        if (PRODUCTION.equalsIgnoreCase(environment)) {
            analytics = analytics.withRequired(true);
        }
        return new HealthDependencies(
                DependencySettings.from(source, RELATIONAL_PREFIX),
                DependencySettings.from(source, CACHE_PREFIX),
                analytics);
    }

    /**
     * Returns the criticality of the optional dependencies.
     */
    public CriticalityFlags criticality() {
        return new CriticalityFlags(cache.required(), analytics.required());
    }
}
