package com.texflow.core.events;

import com.texflow.core.errors.TransientBrokerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link PubSubChannel} over PostgreSQL {@code LISTEN/NOTIFY}.
 * <p>
 * NOTIFY payloads are capped at 8000 bytes, too small for compile logs, so
 * the message goes into the {@code compile_status_events} outbox and the
 * notification carries only its row id. Listeners read the row by id.
 */
public class JdbcNotifyChannel implements PubSubChannel {

    private static final Logger log = LoggerFactory.getLogger(JdbcNotifyChannel.class);

    static final String TABLE_NAME = "compile_status_events";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         BIGSERIAL PRIMARY KEY,
                channel    VARCHAR(128) NOT NULL,
                message    TEXT         NOT NULL,
                created_at TIMESTAMP    DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (channel, message) VALUES (?, ?) RETURNING id
            """.formatted(TABLE_NAME);

    private static final String NOTIFY_SQL = "SELECT pg_notify(?, ?)";

    private static final String PURGE_SQL = """
            DELETE FROM %s WHERE created_at < CURRENT_TIMESTAMP - (? * INTERVAL '1 second')
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcNotifyChannel(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Status event outbox '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void publish(String channel, String message) {
        try (Connection conn = dataSource.getConnection()) {
            long id;
            try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                insert.setString(1, channel);
                insert.setString(2, message);
                try (ResultSet rs = insert.executeQuery()) {
                    rs.next();
                    id = rs.getLong(1);
                }
            }
            try (PreparedStatement notify = conn.prepareStatement(NOTIFY_SQL)) {
                notify.setString(1, channel);
                notify.setString(2, Long.toString(id));
                notify.execute();
            }
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to publish on channel " + channel, e);
        }
    }

    /**
     * Removes outbox rows older than {@code retention}.
     */
    public int purgeOlderThan(Duration retention) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(PURGE_SQL)) {
            stmt.setLong(1, retention.toSeconds());
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to purge status outbox", e);
        }
    }
}
