package com.netra.health;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer instrumentation of the health engine.
 * <p>
 * Meters:
 * <ul>
 *   <li>{@value #PROBE_DURATION} timer, tagged {@code service} and {@code status}</li>
 *   <li>{@value #CACHE_LOOKUPS} counter, tagged {@code service} and {@code result} (hit/miss)</li>
 *   <li>{@value #SNAPSHOTS} counter, tagged {@code status}</li>
 * </ul>
 */
public final class HealthMetrics {

    public static final String PROBE_DURATION = "health.probe.duration";
    public static final String CACHE_LOOKUPS = "health.cache.lookups";
    public static final String SNAPSHOTS = "health.snapshots";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_STATUS = "status";
    public static final String TAG_RESULT = "result";

    private final MeterRegistry registry;

    /**
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     */
    public HealthMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Returns metrics backed by a private in-memory registry.
     */
    public static HealthMetrics inMemory() {
        return new HealthMetrics(new SimpleMeterRegistry());
    }

    /** Records how long a probe took and what it concluded. */
    public void recordProbe(ServiceHealthRecord record, Duration elapsed) {
        Timer.builder(PROBE_DURATION)
                .description("Duration of dependency health probes")
                .tags(TAG_SERVICE, record.service(), TAG_STATUS, record.status().wireValue())
                .register(registry)
                .record(elapsed);
    }

    /** Counts a cache lookup for the service. */
    public void recordCacheLookup(String service, boolean hit) {
        Counter.builder(CACHE_LOOKUPS)
                .description("Health cache lookups")
                .tags(TAG_SERVICE, service, TAG_RESULT, hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    /** Counts an assembled snapshot by overall status. */
    public void recordSnapshot(OverallStatus status) {
        Counter.builder(SNAPSHOTS)
                .description("Assembled system health snapshots")
                .tags(TAG_STATUS, status.wireValue())
                .register(registry)
                .increment();
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }
}
