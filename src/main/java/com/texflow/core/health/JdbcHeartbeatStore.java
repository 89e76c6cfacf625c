package com.texflow.core.health;

import com.texflow.core.errors.TransientBrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link HeartbeatStore}. Rows are keyed by worker
 * instance id and upserted on every beat.
 */
public class JdbcHeartbeatStore implements HeartbeatStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcHeartbeatStore.class);

    static final String TABLE_NAME = "worker_heartbeats";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                instance_id  VARCHAR(255) PRIMARY KEY,
                pid          BIGINT       NOT NULL,
                host         VARCHAR(255),
                heartbeat_ms BIGINT       NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (instance_id, pid, host, heartbeat_ms)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (instance_id)
            DO UPDATE SET pid = EXCLUDED.pid,
                          host = EXCLUDED.host,
                          heartbeat_ms = EXCLUDED.heartbeat_ms
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT instance_id, pid, host, heartbeat_ms
            FROM %s
            ORDER BY heartbeat_ms DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE instance_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcHeartbeatStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Heartbeat table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void publishHeartbeat(Heartbeat heartbeat) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, heartbeat.instanceId());
            stmt.setLong(2, heartbeat.pid());
            stmt.setString(3, heartbeat.host());
            stmt.setLong(4, heartbeat.timestampMs());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to publish heartbeat for " + heartbeat.instanceId(), e);
        }
    }

    @Override
    public Optional<Heartbeat> latest() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SQL);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.of(new Heartbeat(
                    rs.getString("instance_id"),
                    rs.getLong("pid"),
                    rs.getString("host"),
                    rs.getLong("heartbeat_ms")));
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to read worker heartbeat", e);
        }
    }

    @Override
    public void remove(String instanceId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, instanceId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to remove heartbeat for " + instanceId, e);
        }
    }
}
