package com.texflow.core.queue;

import com.texflow.core.model.CompileJob;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Durable work queue for compile jobs, keyed by job id.
 *
 * <p>Implementations must make {@link #claimNext} and the removal inside
 * {@link #requestCancel} atomic across processes so that no two workers
 * ever hold the same job.
 */
public interface JobQueue {

    /**
     * Records the job unless a job with the same id is already known
     * (waiting, delayed, active or completed).
     *
     * @return true if a new job was created, false if this was a no-op
     * @throws com.texflow.core.errors.TransientBrokerException if the broker is unreachable
     */
    default boolean enqueue(CompileJob job) {
        return enqueue(job, Duration.ZERO);
    }

    boolean enqueue(CompileJob job, Duration delay);

    /**
     * Removes a pending job or, if it is already running, leaves it in place.
     * A cancellation marker is set in both cases. Broker failures are logged
     * and reported as {@link CancelResult#unconfirmed()}.
     */
    CancelResult requestCancel(String jobId);

    /**
     * Atomically claims the oldest available job for {@code workerId}.
     * The claim lapses after {@code lease} if the job is neither completed
     * nor failed, after which {@link #requeueStalled} may hand it out again.
     */
    Optional<ClaimedJob> claimNext(String workerId, Duration lease);

    void complete(String jobId);

    void fail(String jobId, String reason);

    Optional<QueueState> state(String jobId);

    Map<QueueState, Long> counts();

    /**
     * Returns expired claims to the waiting state, failing jobs that already
     * stalled {@code maxStalledCount} times.
     *
     * @return number of jobs requeued
     */
    int requeueStalled(int maxStalledCount);

    /**
     * Deletes completed and failed jobs that finished more than
     * {@code olderThan} ago. A purged id may be enqueued again.
     */
    int purgeFinished(Duration olderThan);
}
