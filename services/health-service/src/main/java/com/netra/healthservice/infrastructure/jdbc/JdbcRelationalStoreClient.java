package com.netra.healthservice.infrastructure.jdbc;

import com.netra.health.probe.RelationalHealthResponse;
import com.netra.health.probe.RelationalStoreClient;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import javax.sql.DataSource;

/**
 * JDBC implementation of {@link RelationalStoreClient}: borrows a pooled connection, runs
 * {@value #HEALTH_CHECK_QUERY} with a statement timeout, and reports the database product.
 *
 * <p>JDBC blocks, so the query runs on the supplied executor. Driver errors complete the
 * future exceptionally with the original {@link SQLException}.
 */
public class JdbcRelationalStoreClient implements RelationalStoreClient {

    static final String HEALTH_CHECK_QUERY = "SELECT 1";

    private final DataSource dataSource;
    private final Executor executor;
    private final int queryTimeoutSeconds;

    public JdbcRelationalStoreClient(DataSource dataSource, Executor executor, Duration queryTimeout) {
        if (dataSource == null || executor == null || queryTimeout == null) {
            throw new IllegalArgumentException("dataSource, executor and queryTimeout must not be null");
        }
        this.dataSource = dataSource;
        this.executor = executor;
        this.queryTimeoutSeconds = (int) Math.max(1, (queryTimeout.toMillis() + 999) / 1000);
    }

    @Override
    public CompletableFuture<RelationalHealthResponse> runHealthCheckQuery() {
        return CompletableFuture.supplyAsync(this::query, executor);
    }

    private RelationalHealthResponse query() {
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet resultSet = statement.executeQuery(HEALTH_CHECK_QUERY)) {
                if (!resultSet.next()) {
                    return RelationalHealthResponse.failed("Health check query returned no rows");
                }
            }
            DatabaseMetaData metaData = connection.getMetaData();
            return RelationalHealthResponse.connected(
                    metaData.getDatabaseProductName() + " " + metaData.getDatabaseProductVersion());
        } catch (SQLException e) {
            throw new CompletionException(e);
        }
    }

    int queryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }
}
