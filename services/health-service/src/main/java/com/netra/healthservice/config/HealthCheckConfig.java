package com.netra.healthservice.config;

import com.netra.health.HealthCheckManager;
import com.netra.health.HealthMetrics;
import com.netra.health.config.ConfigurationSource;
import com.netra.health.config.DependencySettings;
import com.netra.health.config.HealthDependencies;
import com.netra.health.probe.AnalyticsStoreProbe;
import com.netra.health.probe.CacheStoreCapability;
import com.netra.health.probe.CacheStoreClient;
import com.netra.health.probe.CacheStoreProbe;
import com.netra.health.probe.RelationalStoreClient;
import com.netra.health.probe.RelationalStoreProbe;
import com.netra.healthservice.infrastructure.jdbc.JdbcRelationalStoreClient;
import com.netra.healthservice.infrastructure.redis.RedisCacheStoreClient;
import io.lettuce.core.RedisURI;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

/**
 * Wires the health engine: dependency settings, client adapters, probes and the single
 * {@link HealthCheckManager}.
 *
 * <p>The cache client is optional. {@link RedisClientConfiguration} only applies when Spring
 * Data Redis is part of the build; without it the {@link CacheStoreCapability} is absent and
 * the cache probe reports {@code dependency_missing}.
 */
@Configuration(proxyBeanMethods = false)
public class HealthCheckConfig {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckConfig.class);

    @Bean
    public ConfigurationSource dependencyConfigurationSource(Environment environment) {
        return key -> Optional.ofNullable(environment.getProperty(key));
    }

    @Bean
    public HealthDependencies healthDependencies(
            ConfigurationSource dependencyConfigurationSource, HealthServiceProperties properties) {
        HealthDependencies dependencies =
                HealthDependencies.load(dependencyConfigurationSource, properties.environment());
        log.info(
                "Health dependencies: postgres={}, redis={} (required={}), clickhouse={} (required={})",
                dependencies.relational().isConfigured() ? "configured" : "defaults",
                dependencies.cache().isConfigured() ? "configured" : "not configured",
                dependencies.cache().required(),
                dependencies.analytics().isConfigured() ? "configured" : "not configured",
                dependencies.analytics().required());
        return dependencies;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService healthProbeExecutor(HealthServiceProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(
                properties.probeThreads(),
                runnable -> {
                    Thread thread = new Thread(runnable, "health-probe-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @Bean
    public RelationalStoreClient relationalStoreClient(
            ObjectProvider<DataSource> dataSource,
            ExecutorService healthProbeExecutor,
            HealthServiceProperties properties) {
        DataSource available = dataSource.getIfAvailable();
        if (available == null) {
            log.warn("No DataSource available; postgres will be reported as failed");
            return RelationalStoreClient.unconfigured();
        }
        Duration timeout = properties.toSettings(null).relationalTimeout();
        return new JdbcRelationalStoreClient(available, healthProbeExecutor, timeout);
    }

    @Bean
    public CacheStoreCapability cacheStoreCapability(ObjectProvider<CacheStoreClient> cacheStoreClient) {
        CacheStoreClient client = cacheStoreClient.getIfAvailable();
        if (client == null) {
            return CacheStoreCapability.absent("No cache client library in this build");
        }
        return CacheStoreCapability.present(client);
    }

    @Bean
    public HttpClient analyticsHttpClient(HealthServiceProperties properties) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(properties.toSettings(null).analyticsTimeout())
                .build();
    }

    @Bean
    public HealthMetrics healthMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry != null ? new HealthMetrics(registry) : HealthMetrics.inMemory();
    }

    @Bean
    public HealthCheckManager healthCheckManager(
            HealthDependencies healthDependencies,
            RelationalStoreClient relationalStoreClient,
            CacheStoreCapability cacheStoreCapability,
            HttpClient analyticsHttpClient,
            HealthMetrics healthMetrics,
            HealthServiceProperties properties) {
        return HealthCheckManager.builder()
                .probe(new RelationalStoreProbe(relationalStoreClient))
                .probe(new CacheStoreProbe(healthDependencies.cache(), cacheStoreCapability))
                .probe(new AnalyticsStoreProbe(healthDependencies.analytics(), analyticsHttpClient))
                .settings(properties.toSettings(healthDependencies.criticality()))
                .metrics(healthMetrics)
                .build();
    }

    /**
     * Redis client adapter, present only in builds that ship Spring Data Redis.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.data.redis.connection.RedisConnectionFactory")
    static class RedisClientConfiguration {

        static final String DEFAULT_HOST = "localhost";
        static final int DEFAULT_PORT = 6379;

        @Bean
        public LettuceConnectionFactory healthRedisConnectionFactory(
                HealthDependencies healthDependencies, HealthServiceProperties properties) {
            RedisStandaloneConfiguration standalone = standaloneConfiguration(healthDependencies.cache());
            LettuceClientConfiguration.LettuceClientConfigurationBuilder client =
                    LettuceClientConfiguration.builder()
                            .commandTimeout(properties.toSettings(null).cacheTimeout());
            if (healthDependencies.cache().secure()) {
                client.useSsl();
            }
            return new LettuceConnectionFactory(standalone, client.build());
        }

        @Bean
        public CacheStoreClient redisCacheStoreClient(
                RedisConnectionFactory healthRedisConnectionFactory, ExecutorService healthProbeExecutor) {
            return new RedisCacheStoreClient(healthRedisConnectionFactory, healthProbeExecutor);
        }

        /**
         * Builds the standalone configuration from {@code REDIS_URL} when set, otherwise from
         * {@code REDIS_HOST}/{@code REDIS_PORT}/{@code REDIS_USER}/{@code REDIS_PASSWORD}.
         */
        static RedisStandaloneConfiguration standaloneConfiguration(DependencySettings settings) {
            RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration();
            if (settings.url() != null) {
                RedisURI uri = RedisURI.create(settings.url());
                configuration.setHostName(uri.getHost());
                configuration.setPort(uri.getPort());
                configuration.setDatabase(uri.getDatabase());
                if (uri.getUsername() != null) {
                    configuration.setUsername(uri.getUsername());
                }
                if (uri.getPassword() != null) {
                    configuration.setPassword(uri.getPassword());
                }
                return configuration;
            }
            configuration.setHostName(settings.host() != null ? settings.host() : DEFAULT_HOST);
            configuration.setPort(settings.port() != null ? settings.port() : DEFAULT_PORT);
            if (settings.user() != null) {
                configuration.setUsername(settings.user());
            }
            if (settings.password() != null) {
                configuration.setPassword(settings.password());
            }
            return configuration;
        }
    }
}
