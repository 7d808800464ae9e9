package com.netra.healthservice.startup;

import com.netra.health.HealthCheckManager;
import com.netra.health.OverallStatus;
import com.netra.health.ServiceHealthRecord;
import com.netra.health.SystemHealthSnapshot;
import com.netra.healthservice.config.HealthServiceProperties;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs a forced health check once the application has started and logs the result.
 *
 * <p>With {@code netra.health.fail-on-startup-failure=true} a {@code failed} overall status,
 * or a check that does not finish within {@code netra.health.startup-timeout}, aborts startup.
 * Otherwise the service keeps running and reports the failure through later checks.
 */
@Component
public class StartupHealthVerifier implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupHealthVerifier.class);

    private final HealthCheckManager manager;
    private final HealthServiceProperties properties;

    public StartupHealthVerifier(HealthCheckManager manager, HealthServiceProperties properties) {
        this.manager = manager;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        verify();
    }

    /**
     * Runs the check and returns the snapshot, or null when it did not complete and startup
     * is allowed to continue.
     *
     * @throws IllegalStateException if startup must be aborted
     */
    public SystemHealthSnapshot verify() {
        SystemHealthSnapshot snapshot;
        try {
            snapshot = manager.checkOverall(true, properties.startupTimeout()).join();
        } catch (CompletionException e) {
            if (properties.failOnStartupFailure()) {
                throw new IllegalStateException("Startup health check did not complete", e.getCause());
            }
            log.error("Startup health check did not complete", e.getCause());
            return null;
        }

        for (ServiceHealthRecord record : snapshot.services().values()) {
            if (record.error() != null) {
                log.info("Startup health: {} is {} ({})", record.service(), record.status().wireValue(), record.error());
            } else {
                log.info("Startup health: {} is {}", record.service(), record.status().wireValue());
            }
        }
        log.info("Startup health: overall {} in {}", snapshot.overallStatus().wireValue(), snapshot.environment());

        if (snapshot.overallStatus() == OverallStatus.FAILED && properties.failOnStartupFailure()) {
            throw new IllegalStateException("Startup health check failed: overall status is failed");
        }
        return snapshot;
    }
}
