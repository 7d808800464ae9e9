package com.netra.health;

import com.netra.health.aggregation.AggregationEngine;
import com.netra.health.aggregation.AggregationRule;
import com.netra.health.aggregation.ServiceStatuses;
import com.netra.health.cache.HealthCache;
import com.netra.health.probe.HealthProbe;
import com.netra.health.probe.TimeoutRace;
import com.netra.health.tracking.ResponseTimeTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs dependency probes and assembles {@link SystemHealthSnapshot}s.
 * <p>
 * A single instance is created at startup and shared by every caller. Probe results are
 * cached for the configured TTL; every fresh result feeds the response-time window of its
 * service, is annotated with the rolling average ({@value #DETAIL_AVG_RESPONSE_TIME}) and
 * replaces the cache entry.
 * <p>
 * {@link #checkOverall(boolean)} runs the three checks concurrently and joins on all of
 * them, so its latency is that of the slowest probe. It either produces a complete
 * snapshot or fails; when the returned future is cancelled or times out, the probes still
 * in flight are cancelled.
 * <p>
 * Unhealthy dependencies are data, never exceptions. A future returned by this class
 * completes exceptionally only with a {@link HealthCheckException} (broken probe), a
 * cancellation, or the caller's own timeout.
 */
public final class HealthCheckManager {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckManager.class);

    /** Detail key holding the service's rolling average response time. */
    public static final String DETAIL_AVG_RESPONSE_TIME = "avg_response_time";

    private final Map<DependencyKind, HealthProbe> probes;
    private final HealthCache cache;
    private final ResponseTimeTracker tracker;
    private final AggregationEngine engine;
    private final HealthCheckSettings settings;
    private final HealthMetrics metrics;
    private final Clock clock;

    private HealthCheckManager(Builder builder) {
        this.probes = indexProbes(builder.probes);
        this.settings = builder.settings != null ? builder.settings : HealthCheckSettings.defaults(null);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.cache = builder.cache != null ? builder.cache : new HealthCache(settings.cacheTtl(), clock);
        this.tracker = builder.tracker != null ? builder.tracker : new ResponseTimeTracker();
        this.engine = builder.engine != null ? builder.engine : new AggregationEngine();
        this.metrics = builder.metrics != null ? builder.metrics : HealthMetrics.inMemory();
    }

    /** Creates a new builder. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks one dependency.
     * <p>
     * Unless {@code force} is set, a valid cached record is returned without probing or
     * touching the response-time window. A forced check skips the cache read but still
     * stores its result.
     *
     * @param kind  the dependency to check
     * @param force bypass the cache read
     * @return a future completing with the (possibly cached) record
     */
    public CompletableFuture<ServiceHealthRecord> check(DependencyKind kind, boolean force) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        String service = kind.serviceName();

        if (!force) {
            Optional<ServiceHealthRecord> cached = cache.get(service);
            metrics.recordCacheLookup(service, cached.isPresent());
            if (cached.isPresent()) {
                log.debug("Serving cached health of {} ({})", service, cached.get().status().wireValue());
                return CompletableFuture.completedFuture(cached.get());
            }
        }

        HealthProbe probe = probes.get(kind);
        long startNanos = System.nanoTime();
        CompletableFuture<ServiceHealthRecord> probed;
        try {
            probed = probe.probe(settings.timeoutFor(kind));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new HealthCheckException("Probe for " + service + " threw instead of returning a record", e));
        }
        if (probed == null) {
            return CompletableFuture.failedFuture(
                    new HealthCheckException("Probe for " + service + " returned no future"));
        }

        CompletableFuture<ServiceHealthRecord> result = new CompletableFuture<>();
        probed.whenComplete((record, error) -> {
            if (error != null) {
                Throwable cause = TimeoutRace.unwrap(error);
                if (cause instanceof CancellationException) {
                    result.cancel(false);
                } else {
                    result.completeExceptionally(
                            new HealthCheckException("Probe for " + service + " completed exceptionally", cause));
                }
            } else if (record == null) {
                result.completeExceptionally(
                        new HealthCheckException("Probe for " + service + " completed without a record"));
            } else {
                try {
                    result.complete(store(service, record, Duration.ofNanos(System.nanoTime() - startNanos)));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        TimeoutRace.propagateCancellation(result, probed);
        return result;
    }

    /**
     * Checks all dependencies concurrently and aggregates their statuses.
     *
     * @param force bypass the cache read for every dependency
     * @return a future completing with a complete snapshot
     */
    public CompletableFuture<SystemHealthSnapshot> checkOverall(boolean force) {
        Map<DependencyKind, CompletableFuture<ServiceHealthRecord>> inFlight = new EnumMap<>(DependencyKind.class);
        for (DependencyKind kind : DependencyKind.values()) {
            inFlight.put(kind, check(kind, force));
        }

        CompletableFuture<SystemHealthSnapshot> snapshot = CompletableFuture
                .allOf(inFlight.values().toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> assemble(inFlight));
        snapshot.whenComplete((result, error) -> {
            if (error != null) {
                inFlight.values().forEach(future -> future.cancel(true));
            }
        });
        return snapshot;
    }

    /**
     * Like {@link #checkOverall(boolean)}, but fails with a {@link java.util.concurrent.TimeoutException}
     * and cancels the probes when no snapshot is ready within {@code deadline}.
     */
    public CompletableFuture<SystemHealthSnapshot> checkOverall(boolean force, Duration deadline) {
        if (deadline == null || deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("deadline must be positive");
        }
        return checkOverall(force).orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Drops every cached record and last-check timestamp. Response-time windows are kept.
     * Checks already in flight are unaffected and will store their results when they finish.
     */
    public void clearCache() {
        cache.clear();
        log.info("Health cache cleared");
    }

    /**
     * Returns the rolling average response time per service, in {@link DependencyKind} order.
     */
    public Map<String, Double> responseTimeAverages() {
        Map<String, Double> averages = new LinkedHashMap<>();
        for (DependencyKind kind : DependencyKind.values()) {
            averages.put(kind.serviceName(), tracker.average(kind.serviceName()));
        }
        return averages;
    }

    /**
     * Returns when the dependency's record was last stored, if it has one.
     */
    public Optional<Instant> lastCheckedAt(DependencyKind kind) {
        return cache.lastCheckedAt(kind.serviceName());
    }

    /**
     * Returns the settings this manager runs with.
     */
    public HealthCheckSettings settings() {
        return settings;
    }

    private ServiceHealthRecord store(String service, ServiceHealthRecord record, Duration elapsed) {
        ServiceHealthRecord annotated = record;
        if (record.responseTimeMs() != null) {
            tracker.record(service, record.responseTimeMs());
            double average = Math.round(tracker.average(service) * 100.0) / 100.0;
            annotated = record.withDetail(DETAIL_AVG_RESPONSE_TIME, average);
        }

        Optional<ServiceHealthRecord> previous = cache.put(service, annotated);
        metrics.recordProbe(annotated, elapsed);
        logTransition(service, previous, annotated);
        return annotated;
    }

    private SystemHealthSnapshot assemble(Map<DependencyKind, CompletableFuture<ServiceHealthRecord>> completed) {
        Map<String, ServiceHealthRecord> services = new LinkedHashMap<>();
        for (Map.Entry<DependencyKind, CompletableFuture<ServiceHealthRecord>> entry : completed.entrySet()) {
            services.put(entry.getKey().serviceName(), entry.getValue().join());
        }

        ServiceStatuses statuses = new ServiceStatuses(
                services.get(DependencyKind.RELATIONAL.serviceName()).status(),
                services.get(DependencyKind.CACHE.serviceName()).status(),
                services.get(DependencyKind.ANALYTICS.serviceName()).status());
        AggregationRule rule = engine.evaluate(statuses, settings.criticality());
        if (rule.outcome() == OverallStatus.UNKNOWN) {
            log.error("No aggregation rule matched statuses {} with {}", statuses, settings.criticality());
        }

        metrics.recordSnapshot(rule.outcome());
        log.debug("Overall health {} (rule {})", rule.outcome().wireValue(), rule.name());
        return new SystemHealthSnapshot(rule.outcome(), services, clock.instant(), settings.environment());
    }

    private static void logTransition(String service, Optional<ServiceHealthRecord> previous,
                                      ServiceHealthRecord current) {
        HealthStatus before = previous.map(ServiceHealthRecord::status).orElse(null);
        if (before != current.status()) {
            log.info("Health of {} changed from {} to {}", service,
                    before == null ? "none" : before.wireValue(), current.status().wireValue());
        }
        if (current.status() == HealthStatus.FAILED) {
            log.warn("Health check for {} failed: {}", service, current.error());
        }
    }

    private static Map<DependencyKind, HealthProbe> indexProbes(Collection<HealthProbe> probes) {
        Map<DependencyKind, HealthProbe> indexed = new EnumMap<>(DependencyKind.class);
        for (HealthProbe probe : probes) {
            if (probe == null || probe.kind() == null) {
                throw new IllegalArgumentException("probes must not be null and must declare a kind");
            }
            if (indexed.put(probe.kind(), probe) != null) {
                throw new IllegalArgumentException("Duplicate probe for " + probe.kind());
            }
        }
        for (DependencyKind kind : DependencyKind.values()) {
            if (!indexed.containsKey(kind)) {
                throw new IllegalArgumentException("Missing probe for " + kind);
            }
        }
        return indexed;
    }

    /**
     * Builder for {@link HealthCheckManager}. Only the three probes are mandatory; every
     * other collaborator has a default.
     */
    public static final class Builder {

        private final List<HealthProbe> probes = new ArrayList<>();
        private HealthCache cache;
        private ResponseTimeTracker tracker;
        private AggregationEngine engine;
        private HealthCheckSettings settings;
        private HealthMetrics metrics;
        private Clock clock;

        private Builder() {
        }

        /** Adds a probe; exactly one per {@link DependencyKind} is required. */
        public Builder probe(HealthProbe probe) {
            this.probes.add(probe);
            return this;
        }

        /** Uses the given cache instead of one built from the settings' TTL. */
        public Builder cache(HealthCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder tracker(ResponseTimeTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder engine(AggregationEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder settings(HealthCheckSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder metrics(HealthMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Clock used for snapshot timestamps and, when no cache is given, cache expiry. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the manager.
         *
         * @throws IllegalArgumentException if a probe is missing or duplicated
         */
        public HealthCheckManager build() {
            return new HealthCheckManager(this);
        }
    }
}
