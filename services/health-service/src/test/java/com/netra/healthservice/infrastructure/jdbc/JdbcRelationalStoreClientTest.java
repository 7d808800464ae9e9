package com.netra.healthservice.infrastructure.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.netra.health.probe.RelationalHealthResponse;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link JdbcRelationalStoreClient} against a mocked JDBC driver.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcRelationalStoreClient")
class JdbcRelationalStoreClientTest {

    private static final Executor DIRECT = Runnable::run;

    @Mock private DataSource dataSource;
    @Mock private Connection connection;
    @Mock private Statement statement;
    @Mock private ResultSet resultSet;
    @Mock private DatabaseMetaData metaData;

    private JdbcRelationalStoreClient client(Duration timeout) {
        return new JdbcRelationalStoreClient(dataSource, DIRECT, timeout);
    }

    @Test
    @DisplayName("reports the engine after a successful round trip")
    void successfulQuery() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(JdbcRelationalStoreClient.HEALTH_CHECK_QUERY)).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getDatabaseProductName()).thenReturn("PostgreSQL");
        when(metaData.getDatabaseProductVersion()).thenReturn("16.2");

        RelationalHealthResponse response = client(Duration.ofSeconds(5)).runHealthCheckQuery().join();

        assertThat(response.connected()).isTrue();
        assertThat(response.engine()).isEqualTo("PostgreSQL 16.2");
        verify(statement).setQueryTimeout(5);
        verify(connection).close();
    }

    @Test
    @DisplayName("an empty result is reported as not connected")
    void emptyResult() throws Exception {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(JdbcRelationalStoreClient.HEALTH_CHECK_QUERY)).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        RelationalHealthResponse response = client(Duration.ofSeconds(5)).runHealthCheckQuery().join();

        assertThat(response.connected()).isFalse();
        assertThat(response.error()).contains("no rows");
    }

    @Test
    @DisplayName("driver errors complete the future exceptionally")
    void driverError() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        assertThatThrownBy(() -> client(Duration.ofSeconds(5)).runHealthCheckQuery().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    @DisplayName("statement timeout is rounded up to whole seconds")
    void queryTimeoutRounding() {
        assertThat(client(Duration.ofMillis(250)).queryTimeoutSeconds()).isEqualTo(1);
        assertThat(client(Duration.ofSeconds(5)).queryTimeoutSeconds()).isEqualTo(5);
        assertThat(client(Duration.ofMillis(5500)).queryTimeoutSeconds()).isEqualTo(6);
    }
}
