package com.netra.healthservice;

import static org.assertj.core.api.Assertions.assertThat;

import com.netra.health.DependencyKind;
import com.netra.health.HealthCheckManager;
import com.netra.health.HealthStatus;
import com.netra.health.OverallStatus;
import com.netra.health.SystemHealthSnapshot;
import com.netra.health.aggregation.CriticalityFlags;
import com.netra.health.config.HealthDependencies;
import com.netra.health.probe.AbstractHealthProbe;
import com.netra.health.probe.CacheStoreCapability;
import com.netra.healthservice.config.HealthServiceProperties;
import com.netra.healthservice.startup.StartupHealthVerifier;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

/**
 * Integration tests for the health service application.
 *
 * <p>The 'test' profile runs without a data source and without cache or analytics settings, so
 * the context must come up and report the relational store as failed rather than refusing to
 * start.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Health Service Application")
class HealthServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private HealthCheckManager manager;

    @Test
    @DisplayName("Spring context loads successfully")
    void contextLoads() {
        assertThat(context).isNotNull();
        assertThat(context.getBeansOfType(HealthCheckManager.class)).hasSize(1);
    }

    @Test
    @DisplayName("Service properties are loaded from test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(HealthServiceProperties.class);
        assertThat(props.name()).isEqualTo("health-service-test");
        assertThat(props.environment()).isEqualTo("test");
        assertThat(props.startupTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(manager.settings().environment()).isEqualTo("test");
    }

    @Test
    @DisplayName("Unset dependencies are optional outside production")
    void dependenciesAreOptional() {
        var dependencies = context.getBean(HealthDependencies.class);
        assertThat(dependencies.criticality()).isEqualTo(CriticalityFlags.noneRequired());
        assertThat(context.getBean(CacheStoreCapability.class).isPresent()).isTrue();
    }

    @Test
    @DisplayName("Snapshot reports a missing data source as failed and unset stores as not configured")
    void snapshotWithoutInfrastructure() {
        SystemHealthSnapshot snapshot = manager.checkOverall(true).join();

        assertThat(snapshot.overallStatus()).isEqualTo(OverallStatus.FAILED);
        assertThat(snapshot.environment()).isEqualTo("test");
        assertThat(snapshot.service(DependencyKind.RELATIONAL).status()).isEqualTo(HealthStatus.FAILED);
        assertThat(snapshot.service(DependencyKind.RELATIONAL).details())
                .containsEntry(AbstractHealthProbe.DETAIL_ERROR_KIND, "configuration_missing_required");
        assertThat(snapshot.service(DependencyKind.CACHE).status()).isEqualTo(HealthStatus.NOT_CONFIGURED);
        assertThat(snapshot.service(DependencyKind.ANALYTICS).status()).isEqualTo(HealthStatus.NOT_CONFIGURED);
    }

    @Test
    @DisplayName("Startup verification has already populated the cache")
    void startupVerificationRan() {
        assertThat(manager.lastCheckedAt(DependencyKind.RELATIONAL)).isPresent();
        assertThat(context.getBean(StartupHealthVerifier.class).verify()).isNotNull();
    }
}
