package com.texflow.core.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.texflow.core.cancel.CancellationRegistry;
import com.texflow.core.errors.TransientBrokerException;
import com.texflow.core.model.CompileJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link JobQueue}.
 * <p>
 * One row per job id in {@code compile_jobs}. Enqueue relies on
 * {@code ON CONFLICT DO NOTHING} for idempotency, claims use
 * {@code FOR UPDATE SKIP LOCKED} so concurrent workers never pick the same
 * row, and cancel-by-removal is a single conditional {@code DELETE}.
 * Completed rows are kept until {@link #purgeFinished} so that a late
 * duplicate enqueue of a finished job stays a no-op.
 */
public class JdbcJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobQueue.class);

    static final String TABLE_NAME = "compile_jobs";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                job_id          VARCHAR(255) PRIMARY KEY,
                queue_name      VARCHAR(64)  NOT NULL,
                payload         TEXT         NOT NULL,
                state           VARCHAR(16)  NOT NULL,
                attempts        INT          NOT NULL DEFAULT 0,
                available_at_ms BIGINT       NOT NULL,
                locked_by       VARCHAR(255),
                locked_until_ms BIGINT,
                failure_reason  TEXT,
                created_at_ms   BIGINT       NOT NULL,
                finished_at_ms  BIGINT
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS %1$s_claim_idx
            ON %1$s (queue_name, state, available_at_ms)
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (job_id, queue_name, payload, state, available_at_ms, created_at_ms)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (job_id) DO NOTHING
            """.formatted(TABLE_NAME);

    private static final String CLAIM_SQL = """
            UPDATE %1$s
            SET state = 'active', attempts = attempts + 1, locked_by = ?, locked_until_ms = ?
            WHERE job_id = (
                SELECT job_id FROM %1$s
                WHERE queue_name = ? AND state IN ('waiting', 'delayed') AND available_at_ms <= ?
                ORDER BY available_at_ms, created_at_ms
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING job_id, payload, attempts
            """.formatted(TABLE_NAME);

    private static final String DELETE_PENDING_SQL = """
            DELETE FROM %s WHERE job_id = ? AND state IN ('waiting', 'delayed')
            """.formatted(TABLE_NAME);

    private static final String SELECT_STATE_SQL = """
            SELECT state FROM %s WHERE job_id = ?
            """.formatted(TABLE_NAME);

    private static final String FINISH_SQL = """
            UPDATE %s
            SET state = ?, failure_reason = ?, finished_at_ms = ?, locked_by = NULL, locked_until_ms = NULL
            WHERE job_id = ? AND state = 'active'
            """.formatted(TABLE_NAME);

    private static final String COUNT_SQL = """
            SELECT state, COUNT(*) FROM %s WHERE queue_name = ? GROUP BY state
            """.formatted(TABLE_NAME);

    private static final String FAIL_STALLED_SQL = """
            UPDATE %s
            SET state = 'failed', failure_reason = 'job stalled more than allowable limit',
                finished_at_ms = ?, locked_by = NULL, locked_until_ms = NULL
            WHERE queue_name = ? AND state = 'active' AND locked_until_ms < ? AND attempts >= ?
            """.formatted(TABLE_NAME);

    private static final String REQUEUE_STALLED_SQL = """
            UPDATE %s
            SET state = 'waiting', available_at_ms = ?, locked_by = NULL, locked_until_ms = NULL
            WHERE queue_name = ? AND state = 'active' AND locked_until_ms < ?
            """.formatted(TABLE_NAME);

    private static final String PURGE_FINISHED_SQL = """
            DELETE FROM %s
            WHERE queue_name = ? AND state IN ('completed', 'failed') AND finished_at_ms < ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final CancellationRegistry cancellationRegistry;
    private final String queueName;
    private final Duration cancelTtl;
    private final Clock clock;

    public JdbcJobQueue(DataSource dataSource, ObjectMapper objectMapper,
                        CancellationRegistry cancellationRegistry, String queueName, Duration cancelTtl) {
        this(dataSource, objectMapper, cancellationRegistry, queueName, cancelTtl, Clock.systemUTC());
    }

    public JdbcJobQueue(DataSource dataSource, ObjectMapper objectMapper,
                        CancellationRegistry cancellationRegistry, String queueName,
                        Duration cancelTtl, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.cancellationRegistry = cancellationRegistry;
        this.queueName = queueName;
        this.cancelTtl = cancelTtl;
        this.clock = clock;
    }

    /**
     * Creates the queue table and its claim index if missing.
     * Called once at startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
                stmt.execute();
            }
            try (PreparedStatement stmt = conn.prepareStatement(CREATE_INDEX_SQL)) {
                stmt.execute();
            }
            log.info("Queue table '{}' ensured (queue '{}')", TABLE_NAME, queueName);
        }
    }

    @Override
    public boolean enqueue(CompileJob job, Duration delay) {
        boolean delayed = delay != null && !delay.isZero() && !delay.isNegative();
        long now = clock.millis();
        String payload = serialize(job);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, job.jobId());
            stmt.setString(2, queueName);
            stmt.setString(3, payload);
            stmt.setString(4, (delayed ? QueueState.DELAYED : QueueState.WAITING).dbValue());
            stmt.setLong(5, delayed ? now + delay.toMillis() : now);
            stmt.setLong(6, now);
            boolean inserted = stmt.executeUpdate() > 0;
            if (!inserted) {
                log.debug("Job {} already known, enqueue is a no-op", job.jobId());
            }
            return inserted;
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to enqueue job " + job.jobId(), e);
        }
    }

    @Override
    public CancelResult requestCancel(String jobId) {
        try {
            cancellationRegistry.setCancel(jobId, cancelTtl);
        } catch (TransientBrokerException e) {
            log.warn("Could not set cancel marker for job {}: {}", jobId, e.getMessage());
            return CancelResult.unconfirmed();
        }

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(DELETE_PENDING_SQL)) {
                stmt.setString(1, jobId);
                if (stmt.executeUpdate() > 0) {
                    log.info("Removed pending job {} from queue", jobId);
                    return CancelResult.removed();
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_STATE_SQL)) {
                stmt.setString(1, jobId);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next() && QueueState.fromDbValue(rs.getString(1)) == QueueState.ACTIVE) {
                        return CancelResult.running();
                    }
                }
            }
            return CancelResult.notFound();
        } catch (SQLException e) {
            log.warn("Failed to cancel job {} in queue: {}", jobId, e.getMessage());
            return CancelResult.unconfirmed();
        }
    }

    @Override
    public Optional<ClaimedJob> claimNext(String workerId, Duration lease) {
        long now = clock.millis();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CLAIM_SQL)) {
            stmt.setString(1, workerId);
            stmt.setLong(2, now + lease.toMillis());
            stmt.setString(3, queueName);
            stmt.setLong(4, now);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                CompileJob job = deserialize(rs.getString("job_id"), rs.getString("payload"));
                return Optional.of(new ClaimedJob(job, rs.getInt("attempts")));
            }
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to claim next job", e);
        }
    }

    @Override
    public void complete(String jobId) {
        finish(jobId, QueueState.COMPLETED, null);
    }

    @Override
    public void fail(String jobId, String reason) {
        finish(jobId, QueueState.FAILED, reason);
    }

    @Override
    public Optional<QueueState> state(String jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_STATE_SQL)) {
            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(QueueState.fromDbValue(rs.getString(1))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to read state of job " + jobId, e);
        }
    }

    @Override
    public Map<QueueState, Long> counts() {
        var counts = new EnumMap<QueueState, Long>(QueueState.class);
        for (QueueState state : QueueState.values()) {
            counts.put(state, 0L);
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL)) {
            stmt.setString(1, queueName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(QueueState.fromDbValue(rs.getString(1)), rs.getLong(2));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to count jobs in queue " + queueName, e);
        }
    }

    @Override
    public int requeueStalled(int maxStalledCount) {
        long now = clock.millis();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement fail = conn.prepareStatement(FAIL_STALLED_SQL);
                 PreparedStatement requeue = conn.prepareStatement(REQUEUE_STALLED_SQL)) {
                fail.setLong(1, now);
                fail.setString(2, queueName);
                fail.setLong(3, now);
                fail.setInt(4, maxStalledCount);
                int failed = fail.executeUpdate();

                requeue.setLong(1, now);
                requeue.setString(2, queueName);
                requeue.setLong(3, now);
                int requeued = requeue.executeUpdate();

                conn.commit();
                if (failed > 0 || requeued > 0) {
                    log.warn("Stall check: requeued {} job(s), failed {} job(s) over the stall limit",
                            requeued, failed);
                }
                return requeued;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to requeue stalled jobs", e);
        }
    }

    @Override
    public int purgeFinished(Duration olderThan) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(PURGE_FINISHED_SQL)) {
            stmt.setString(1, queueName);
            stmt.setLong(2, clock.millis() - olderThan.toMillis());
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to purge finished jobs", e);
        }
    }

    private void finish(String jobId, QueueState state, String reason) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(FINISH_SQL)) {
            stmt.setString(1, state.dbValue());
            stmt.setString(2, reason);
            stmt.setLong(3, clock.millis());
            stmt.setString(4, jobId);
            if (stmt.executeUpdate() == 0) {
                log.debug("Job {} was not active when marking it {}", jobId, state.dbValue());
            }
        } catch (SQLException e) {
            throw new TransientBrokerException("Failed to mark job " + jobId + " " + state.dbValue(), e);
        }
    }

    private String serialize(CompileJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize job " + job.jobId(), e);
        }
    }

    private CompileJob deserialize(String jobId, String payload) throws SQLException {
        try {
            return objectMapper.readValue(payload, CompileJob.class);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt payload for job " + jobId, e);
        }
    }
}
