package com.texflow.core.cancel;

import com.texflow.core.errors.TransientBrokerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JdbcCancellationRegistryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private JdbcCancellationRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        registry = new JdbcCancellationRegistry(dataSource, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void setCancelUpsertsExpiry() throws Exception {
        registry.setCancel("job-1", Duration.ofMinutes(15));

        verify(connection).prepareStatement(contains("ON CONFLICT (job_id)"));
        verify(statement).setString(1, "job-1");
        verify(statement).setLong(2, NOW.toEpochMilli() + Duration.ofMinutes(15).toMillis());
        verify(statement).executeUpdate();
    }

    @Test
    void isCanceledComparesAgainstNow() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(statement.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);

        assertTrue(registry.isCanceled("job-1"));
        verify(statement).setLong(2, NOW.toEpochMilli());
    }

    @Test
    void databaseFailureIsTransient() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("refused"));

        assertThrows(TransientBrokerException.class, () -> registry.isCanceled("job-1"));
        assertThrows(TransientBrokerException.class, () -> registry.setCancel("job-1", Duration.ofMinutes(1)));
    }
}
