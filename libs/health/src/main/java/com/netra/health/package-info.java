/**
 * Service health aggregation engine.
 *
 * <p>{@link com.netra.health.HealthCheckManager} is the entry point: it probes the relational,
 * cache and analytics stores through {@link com.netra.health.probe.HealthProbe}s, memoizes
 * results in a {@link com.netra.health.cache.HealthCache}, keeps rolling latency windows in a
 * {@link com.netra.health.tracking.ResponseTimeTracker}, and derives one overall status with
 * the {@link com.netra.health.aggregation.AggregationEngine} rule table.
 *
 * <p>The package has no framework dependency; services wire it up in their composition root.
 */
package com.netra.health;
