package com.netra.health.probe;

import com.netra.health.DependencyKind;
import com.netra.health.ServiceHealthRecord;
import com.netra.health.config.DependencySettings;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

/**
 * Probes the cache store with a ping followed by a server-info request.
 * <p>
 * Without a host or URL the cache is reported as {@code not_configured}. Memory usage above
 * {@link #MEMORY_PRESSURE_THRESHOLD} of the configured limit is degraded.
 */
public final class CacheStoreProbe extends AbstractHealthProbe<CacheServerInfo> {

    /** Hard bound for ping plus info (5 seconds). */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    /** Used/max memory ratio above which the cache is degraded. */
    public static final double MEMORY_PRESSURE_THRESHOLD = 0.8;

    /** Detail key set when the client library is unavailable. */
    public static final String DETAIL_DEPENDENCY_MISSING = "dependency_missing";

    private final DependencySettings settings;
    private final CacheStoreCapability capability;

    public CacheStoreProbe(DependencySettings settings, CacheStoreCapability capability) {
        this(settings, capability, Clock.systemUTC(), System::nanoTime);
    }

    public CacheStoreProbe(DependencySettings settings, CacheStoreCapability capability,
                           Clock clock, LongSupplier nanoTicker) {
        super(clock, nanoTicker);
        if (settings == null || capability == null) {
            throw new IllegalArgumentException("settings and capability must not be null");
        }
        this.settings = settings;
        this.capability = capability;
    }

    @Override
    public DependencyKind kind() {
        return DependencyKind.CACHE;
    }

    @Override
    protected Optional<ServiceHealthRecord> precheck() {
        if (!settings.isConfigured()) {
            return Optional.of(ServiceHealthRecord.notConfigured(serviceName(),
                    "No " + settings.prefix() + "_HOST or " + settings.prefix() + "_URL configured",
                    clock.instant()));
        }
        if (!capability.isPresent()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put(DETAIL_DEPENDENCY_MISSING, true);
            details.put("reason", capability.missingReason());
            return Optional.of(failed("Cache client library not available",
                    ProbeErrorKind.DEPENDENCY_MISSING, details));
        }
        return Optional.empty();
    }

    @Override
    protected CompletableFuture<CacheServerInfo> execute(Duration timeout) {
        CacheStoreClient client = capability.client().orElseThrow();
        return client.ping().thenCompose(pong -> client.info());
    }

    @Override
    protected ServiceHealthRecord classify(CacheServerInfo info, double responseTimeMs) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (info == null) {
            return ServiceHealthRecord.healthy(serviceName(), responseTimeMs, details, clock.instant());
        }
        if (info.version() != null) {
            details.put("version", info.version());
        }
        details.put("used_memory", info.usedMemory());
        details.put("max_memory", info.maxMemory());

        OptionalDouble ratio = info.memoryUsageRatio();
        if (ratio.isPresent()) {
            details.put("memory_usage_ratio", Math.round(ratio.getAsDouble() * 1000.0) / 1000.0);
            if (ratio.getAsDouble() > MEMORY_PRESSURE_THRESHOLD) {
                details.put(DETAIL_WARNING, String.format(Locale.ROOT,
                        "High memory usage: %.1f%%", ratio.getAsDouble() * 100));
                return ServiceHealthRecord.degraded(serviceName(), responseTimeMs, details, clock.instant());
            }
        }
        return ServiceHealthRecord.healthy(serviceName(), responseTimeMs, details, clock.instant());
    }
}
