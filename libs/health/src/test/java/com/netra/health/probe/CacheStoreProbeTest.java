package com.netra.health.probe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.netra.health.HealthStatus;
import com.netra.health.ServiceHealthRecord;
import com.netra.health.config.ConfigurationSource;
import com.netra.health.config.DependencySettings;
import com.netra.health.testing.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CacheStoreProbe")
class CacheStoreProbeTest {

    private static final DependencySettings CONFIGURED =
            DependencySettings.from(ConfigurationSource.of(Map.of("REDIS_HOST", "cache.internal")), "REDIS");

    private final MutableClock clock = new MutableClock(Instant.parse("2026-04-01T00:00:00Z"));

    @Mock
    private CacheStoreClient client;

    private CacheStoreProbe probe(DependencySettings settings, CacheStoreCapability capability) {
        return new CacheStoreProbe(settings, capability, clock, SteppingTicker.ofMillis(0, 3));
    }

    private ServiceHealthRecord probeWithInfo(CacheServerInfo info) {
        when(client.ping()).thenReturn(CompletableFuture.completedFuture("PONG"));
        when(client.info()).thenReturn(CompletableFuture.completedFuture(info));
        return probe(CONFIGURED, CacheStoreCapability.present(client)).probe(CacheStoreProbe.DEFAULT_TIMEOUT).join();
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("no host or URL is not configured and never touches the client")
        void unconfigured() {
            ServiceHealthRecord record = probe(DependencySettings.unconfigured("REDIS"),
                    CacheStoreCapability.present(client)).probe(CacheStoreProbe.DEFAULT_TIMEOUT).join();

            assertThat(record.status()).isEqualTo(HealthStatus.NOT_CONFIGURED);
            assertThat(record.details()).containsEntry("reason", "No REDIS_HOST or REDIS_URL configured");
            verifyNoInteractions(client);
        }

        @Test
        @DisplayName("required flag alone does not turn unconfigured into failed")
        void requiredButUnconfigured() {
            var settings = DependencySettings.unconfigured("REDIS").withRequired(true);

            ServiceHealthRecord record = probe(settings, CacheStoreCapability.present(client))
                    .probe(CacheStoreProbe.DEFAULT_TIMEOUT).join();

            assertThat(record.status()).isEqualTo(HealthStatus.NOT_CONFIGURED);
        }

        @Test
        @DisplayName("missing client library is failed with a dependency_missing marker")
        void missingClientLibrary() {
            ServiceHealthRecord record = probe(CONFIGURED, CacheStoreCapability.absent("redis client not on classpath"))
                    .probe(CacheStoreProbe.DEFAULT_TIMEOUT).join();

            assertThat(record.status()).isEqualTo(HealthStatus.FAILED);
            assertThat(record.error()).isEqualTo("Cache client library not available");
            assertThat(record.details())
                    .containsEntry(CacheStoreProbe.DETAIL_DEPENDENCY_MISSING, true)
                    .containsEntry("reason", "redis client not on classpath")
                    .containsEntry(AbstractHealthProbe.DETAIL_ERROR_KIND, "dependency_missing");
        }
    }

    @Nested
    @DisplayName("Memory pressure")
    class MemoryPressure {

        @Test
        @DisplayName("low memory usage is healthy and reports server details")
        void healthy() {
            ServiceHealthRecord record = probeWithInfo(new CacheServerInfo("7.2.4", 100, 1000));

            assertThat(record.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(record.responseTimeMs()).isEqualTo(3.0);
            assertThat(record.details())
                    .containsEntry("version", "7.2.4")
                    .containsEntry("used_memory", 100L)
                    .containsEntry("max_memory", 1000L)
                    .containsEntry("memory_usage_ratio", 0.1);
        }

        @Test
        @DisplayName("usage exactly at the threshold is still healthy")
        void atThreshold() {
            assertThat(probeWithInfo(new CacheServerInfo("7.2.4", 800, 1000)).status()).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("usage above the threshold is degraded with a warning")
        void degraded() {
            ServiceHealthRecord record = probeWithInfo(new CacheServerInfo("7.2.4", 850, 1000));

            assertThat(record.status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(record.connected()).isTrue();
            assertThat(record.details()).containsEntry(AbstractHealthProbe.DETAIL_WARNING, "High memory usage: 85.0%");
        }

        @Test
        @DisplayName("an unlimited cache reports no ratio and is healthy")
        void unlimited() {
            ServiceHealthRecord record = probeWithInfo(new CacheServerInfo("7.2.4", 5_000_000, 0));

            assertThat(record.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(record.details()).doesNotContainKey("memory_usage_ratio");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a failed ping skips the info request")
        void pingFailure() {
            when(client.ping()).thenReturn(CompletableFuture.failedFuture(new IOException("Connection refused")));

            ServiceHealthRecord record = probe(CONFIGURED, CacheStoreCapability.present(client))
                    .probe(CacheStoreProbe.DEFAULT_TIMEOUT).join();

            assertThat(record.status()).isEqualTo(HealthStatus.FAILED);
            assertThat(record.error()).isEqualTo("Connection refused");
            assertThat(record.details()).containsEntry(AbstractHealthProbe.DETAIL_EXCEPTION_TYPE, "IOException");
            verify(client, never()).info();
        }

        @Test
        @DisplayName("an unanswered ping times out and is cancelled")
        void pingTimeout() throws Exception {
            CompletableFuture<String> hanging = new CompletableFuture<>();
            when(client.ping()).thenReturn(hanging);

            ServiceHealthRecord record = probe(CONFIGURED, CacheStoreCapability.present(client))
                    .probe(Duration.ofMillis(100)).get(5, TimeUnit.SECONDS);

            assertThat(record.status()).isEqualTo(HealthStatus.FAILED);
            assertThat(record.error()).isEqualTo("Connection timeout (100ms)");
            assertThat(AbstractHealthProbe.describe(CacheStoreProbe.DEFAULT_TIMEOUT)).isEqualTo("5s");
        }
    }
}
