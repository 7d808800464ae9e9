package com.netra.health.probe;

import com.netra.health.DependencyKind;
import com.netra.health.ServiceHealthRecord;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * A bounded-time connectivity check against one dependency.
 * <p>
 * Implementations report every dependency problem (missing settings, timeouts, refused
 * connections, missing client libraries) as a {@code failed} or {@code not_configured}
 * record. The returned future completes exceptionally only when it is cancelled or the
 * probe itself is broken.
 */
public interface HealthProbe {

    /**
     * Returns the dependency this probe checks.
     */
    DependencyKind kind();

    /**
     * Runs the check.
     *
     * @param timeout upper bound on the check's duration
     * @return a future completing with the classified record
     */
    CompletableFuture<ServiceHealthRecord> probe(Duration timeout);
}
