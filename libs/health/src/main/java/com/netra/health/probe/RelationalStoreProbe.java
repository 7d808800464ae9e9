package com.netra.health.probe;

import com.netra.health.DependencyKind;
import com.netra.health.ServiceHealthRecord;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;

/**
 * Probes the relational store with a round-trip query.
 * <p>
 * Connected within {@link #SLOW_RESPONSE_THRESHOLD_MS} is healthy, connected but slower is
 * degraded, anything else is failed. The relational store is always required, so a missing
 * data source is a failure rather than {@code not_configured}.
 */
public final class RelationalStoreProbe extends AbstractHealthProbe<RelationalHealthResponse> {

    /** Default bound for the round trip (5 seconds). */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    /** Response times above this are classified as degraded. */
    public static final double SLOW_RESPONSE_THRESHOLD_MS = 1000.0;

    private final RelationalStoreClient client;

    public RelationalStoreProbe(RelationalStoreClient client) {
        this(client, Clock.systemUTC(), System::nanoTime);
    }

    public RelationalStoreProbe(RelationalStoreClient client, Clock clock, LongSupplier nanoTicker) {
        super(clock, nanoTicker);
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        this.client = client;
    }

    @Override
    public DependencyKind kind() {
        return DependencyKind.RELATIONAL;
    }

    @Override
    protected Optional<ServiceHealthRecord> precheck() {
        if (!client.isConfigured()) {
            return Optional.of(failed(serviceName() + " is required but not configured",
                    ProbeErrorKind.CONFIGURATION_MISSING_REQUIRED, Map.of()));
        }
        return Optional.empty();
    }

    @Override
    protected CompletableFuture<RelationalHealthResponse> execute(Duration timeout) {
        return client.runHealthCheckQuery();
    }

    @Override
    protected ServiceHealthRecord classify(RelationalHealthResponse response, double responseTimeMs) {
        if (response == null || !response.connected()) {
            String error = response == null ? null : response.error();
            return failed(sanitizer.sanitize(error == null ? "Health check query failed" : error),
                    ProbeErrorKind.CONNECTIVITY_FAILURE,
                    Map.of(DETAIL_EXCEPTION_TYPE, "HealthCheckQueryFailed"));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        if (response.engine() != null) {
            details.put("engine", response.engine());
        }
        if (responseTimeMs > SLOW_RESPONSE_THRESHOLD_MS) {
            details.put(DETAIL_WARNING, String.format(Locale.ROOT,
                    "Slow response time: %.2fms (threshold %.0fms)", responseTimeMs, SLOW_RESPONSE_THRESHOLD_MS));
            return ServiceHealthRecord.degraded(serviceName(), responseTimeMs, details, clock.instant());
        }
        return ServiceHealthRecord.healthy(serviceName(), responseTimeMs, details, clock.instant());
    }
}
