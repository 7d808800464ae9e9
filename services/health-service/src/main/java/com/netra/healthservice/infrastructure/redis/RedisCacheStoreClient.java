package com.netra.healthservice.infrastructure.redis;

import com.netra.health.probe.CacheServerInfo;
import com.netra.health.probe.CacheStoreClient;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * Spring Data Redis implementation of {@link CacheStoreClient}.
 *
 * <p>Each call borrows a connection from the factory on the supplied executor. Command
 * timeouts reported by the driver are rethrown as {@link TimeoutException} so the probe
 * classifies them as timeouts rather than generic failures.
 */
public class RedisCacheStoreClient implements CacheStoreClient {

    private final RedisConnectionFactory connectionFactory;
    private final Executor executor;

    public RedisCacheStoreClient(RedisConnectionFactory connectionFactory, Executor executor) {
        if (connectionFactory == null || executor == null) {
            throw new IllegalArgumentException("connectionFactory and executor must not be null");
        }
        this.connectionFactory = connectionFactory;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> ping() {
        return CompletableFuture.supplyAsync(() -> withConnection(RedisConnection::ping), executor);
    }

    @Override
    public CompletableFuture<CacheServerInfo> info() {
        return CompletableFuture.supplyAsync(
                () -> withConnection(connection -> toServerInfo(
                        connection.serverCommands().info("server"),
                        connection.serverCommands().info("memory"))),
                executor);
    }

    /**
     * Extracts version and memory figures from {@code INFO server} and {@code INFO memory}
     * replies. Missing or unparsable numbers count as 0.
     */
    static CacheServerInfo toServerInfo(Properties server, Properties memory) {
        String version = server == null ? null : server.getProperty("redis_version");
        return new CacheServerInfo(
                version,
                parseLong(memory, "used_memory"),
                parseLong(memory, "maxmemory"));
    }

    private <T> T withConnection(Function<RedisConnection, T> action) {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            return action.apply(connection);
        } catch (QueryTimeoutException e) {
            TimeoutException timeout = new TimeoutException(e.getMessage());
            timeout.initCause(e);
            throw new CompletionException(timeout);
        }
    }

    private static long parseLong(Properties properties, String key) {
        if (properties == null) {
            return 0L;
        }
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
