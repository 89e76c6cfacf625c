package com.texflow.core.cancel;

import com.texflow.core.errors.TransientBrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link CancellationRegistry} backed by a PostgreSQL table, shared by every
 * web and worker process pointing at the same database.
 * <p>
 * Expiry is stored as epoch milliseconds and compared against this process's
 * clock, so expired rows read as absent even before {@link #purgeExpired()}
 * deletes them.
 */
public class JdbcCancellationRegistry implements CancellationRegistry {

    private static final Logger log = LoggerFactory.getLogger(JdbcCancellationRegistry.class);

    static final String TABLE_NAME = "compile_cancellations";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                job_id        VARCHAR(255) PRIMARY KEY,
                expires_at_ms BIGINT NOT NULL,
                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (job_id, expires_at_ms)
            VALUES (?, ?)
            ON CONFLICT (job_id)
            DO UPDATE SET expires_at_ms = EXCLUDED.expires_at_ms
            """.formatted(TABLE_NAME);

    private static final String SELECT_ACTIVE_SQL = """
            SELECT 1 FROM %s WHERE job_id = ? AND expires_at_ms > ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE job_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_EXPIRED_SQL = """
            DELETE FROM %s WHERE expires_at_ms <= ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcCancellationRegistry(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcCancellationRegistry(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Cancellation table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void setCancel(String jobId, Duration ttl) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, jobId);
            stmt.setLong(2, clock.millis() + ttl.toMillis());
            stmt.executeUpdate();
            log.debug("Cancel marker set for job {} (ttl {}s)", jobId, ttl.toSeconds());
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to set cancel marker for job " + jobId, e);
        }
    }

    @Override
    public boolean isCanceled(String jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ACTIVE_SQL)) {
            stmt.setString(1, jobId);
            stmt.setLong(2, clock.millis());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to read cancel marker for job " + jobId, e);
        }
    }

    @Override
    public void clear(String jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, jobId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to clear cancel marker for job " + jobId, e);
        }
    }

    @Override
    public int purgeExpired() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_EXPIRED_SQL)) {
            stmt.setLong(1, clock.millis());
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to purge expired cancel markers", e);
        }
    }
}
