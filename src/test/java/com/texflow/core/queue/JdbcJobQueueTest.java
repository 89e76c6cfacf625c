package com.texflow.core.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.texflow.core.cancel.CancellationRegistry;
import com.texflow.core.errors.TransientBrokerException;
import com.texflow.core.model.CompileJob;
import com.texflow.core.model.Engine;
import com.texflow.core.model.JobKind;
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

/**
 * Statement-level tests against a mocked {@link DataSource}; no database required.
 */
class JdbcJobQueueTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private CancellationRegistry registry;
    private ObjectMapper objectMapper;
    private JdbcJobQueue queue;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        registry = mock(CancellationRegistry.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        objectMapper = new ObjectMapper().findAndRegisterModules();
        queue = new JdbcJobQueue(dataSource, objectMapper, registry, "compile-jobs",
                Duration.ofMinutes(15), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CompileJob job(String id) {
        return new CompileJob(id, JobKind.PROJECT, "/srv/projects/p1", "thesis.tex", Engine.XELATEX,
                "p1", "u1", NOW);
    }

    @Test
    void enqueueInsertsPendingRow() throws Exception {
        when(statement.executeUpdate()).thenReturn(1);

        assertTrue(queue.enqueue(job("a")));

        verify(connection).prepareStatement(contains("ON CONFLICT (job_id) DO NOTHING"));
        verify(statement).setString(1, "a");
        verify(statement).setString(2, "compile-jobs");
        verify(statement).setString(4, "waiting");
        verify(statement).setLong(5, NOW.toEpochMilli());
    }

    @Test
    void duplicateEnqueueIsNoOp() throws Exception {
        when(statement.executeUpdate()).thenReturn(0);

        assertFalse(queue.enqueue(job("a")));
    }

    @Test
    void delayedEnqueueSetsAvailability() throws Exception {
        when(statement.executeUpdate()).thenReturn(1);

        queue.enqueue(job("a"), Duration.ofSeconds(5));

        verify(statement).setString(4, "delayed");
        verify(statement).setLong(5, NOW.toEpochMilli() + 5_000);
    }

    @Test
    void enqueueFailureIsTransient() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

        assertThrows(TransientBrokerException.class, () -> queue.enqueue(job("a")));
    }

    @Test
    void claimDeserializesPayload() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(statement.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getString("job_id")).thenReturn("a");
        when(rs.getString("payload")).thenReturn(objectMapper.writeValueAsString(job("a")));
        when(rs.getInt("attempts")).thenReturn(1);

        ClaimedJob claimed = queue.claimNext("w1", Duration.ofMinutes(2)).orElseThrow();

        assertEquals("a", claimed.jobId());
        assertEquals(Engine.XELATEX, claimed.job().requestedEngine());
        assertEquals("thesis.tex", claimed.job().mainFile());
        assertEquals(1, claimed.attempts());
        verify(connection).prepareStatement(contains("FOR UPDATE SKIP LOCKED"));
        verify(statement).setLong(2, NOW.toEpochMilli() + 120_000);
    }

    @Test
    void emptyClaim() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(statement.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(false);

        assertTrue(queue.claimNext("w1", Duration.ofMinutes(2)).isEmpty());
    }

    @Test
    void cancelOfPendingRowRemovesIt() throws Exception {
        when(statement.executeUpdate()).thenReturn(1);

        CancelResult result = queue.requestCancel("a");

        assertTrue(result.wasQueued());
        verify(registry).setCancel("a", Duration.ofMinutes(15));
    }

    @Test
    void cancelOfActiveRowReportsRunning() throws Exception {
        when(statement.executeUpdate()).thenReturn(0);
        ResultSet rs = mock(ResultSet.class);
        when(statement.executeQuery()).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn("active");

        CancelResult result = queue.requestCancel("a");

        assertFalse(result.wasQueued());
        assertTrue(result.wasRunning());
    }

    @Test
    void cancelWithUnreachableDatabaseIsUnconfirmed() throws Exception {
        when(dataSource.getConnection()).thenThrow(new SQLException("timeout"));

        CancelResult result = queue.requestCancel("a");

        assertFalse(result.confirmed());
    }

    @Test
    void cancelWithoutMarkerIsUnconfirmed() {
        doThrow(new TransientBrokerException("down", null)).when(registry).setCancel(anyString(), any());

        assertFalse(queue.requestCancel("a").confirmed());
        verifyNoInteractions(dataSource);
    }

    @Test
    void failRecordsReason() throws Exception {
        when(statement.executeUpdate()).thenReturn(1);

        queue.fail("a", "docker unreachable");

        verify(statement).setString(1, "failed");
        verify(statement).setString(2, "docker unreachable");
        verify(statement).setString(4, "a");
    }

    @Test
    void stalledCheckRollsBackOnError() throws Exception {
        when(statement.executeUpdate()).thenThrow(new SQLException("deadlock"));

        assertThrows(TransientBrokerException.class, () -> queue.requeueStalled(2));
        verify(connection).rollback();
        verify(connection).setAutoCommit(true);
    }
}
