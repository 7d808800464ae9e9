package com.netra.healthservice;

import com.netra.healthservice.config.HealthServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Netra health service: composition root of the health aggregation engine.
 *
 * <p>Builds exactly one {@link com.netra.health.HealthCheckManager} with its probes and
 * client adapters (see {@link com.netra.healthservice.config.HealthCheckConfig}) and verifies
 * dependency health once at startup. Transport layers obtain the manager from the context.
 */
@SpringBootApplication
@EnableConfigurationProperties(HealthServiceProperties.class)
public class HealthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(HealthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HealthServiceApplication.class, args);
        log.info("Netra health service started successfully");
    }
}
