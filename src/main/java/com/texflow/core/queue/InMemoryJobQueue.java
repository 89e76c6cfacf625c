package com.texflow.core.queue;

import com.texflow.core.cancel.CancellationRegistry;
import com.texflow.core.errors.TransientBrokerException;
import com.texflow.core.model.CompileJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single-process {@link JobQueue} used when no database is configured.
 * Same semantics as the JDBC queue, but jobs are lost on restart.
 */
public class InMemoryJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobQueue.class);

    private final Map<String, Entry> jobs = new LinkedHashMap<>();
    private final CancellationRegistry cancellationRegistry;
    private final Duration cancelTtl;
    private final Clock clock;

    public InMemoryJobQueue(CancellationRegistry cancellationRegistry, Duration cancelTtl) {
        this(cancellationRegistry, cancelTtl, Clock.systemUTC());
    }

    public InMemoryJobQueue(CancellationRegistry cancellationRegistry, Duration cancelTtl, Clock clock) {
        this.cancellationRegistry = cancellationRegistry;
        this.cancelTtl = cancelTtl;
        this.clock = clock;
    }

    @Override
    public synchronized boolean enqueue(CompileJob job, Duration delay) {
        if (jobs.containsKey(job.jobId())) {
            log.debug("Job {} already known, enqueue is a no-op", job.jobId());
            return false;
        }
        boolean delayed = delay != null && !delay.isZero() && !delay.isNegative();
        var entry = new Entry(job);
        entry.state = delayed ? QueueState.DELAYED : QueueState.WAITING;
        entry.availableAt = delayed ? clock.instant().plus(delay) : clock.instant();
        jobs.put(job.jobId(), entry);
        return true;
    }

    @Override
    public CancelResult requestCancel(String jobId) {
        try {
            cancellationRegistry.setCancel(jobId, cancelTtl);
        } catch (TransientBrokerException e) {
            log.warn("Could not set cancel marker for job {}: {}", jobId, e.getMessage());
            return CancelResult.unconfirmed();
        }
        synchronized (this) {
            Entry entry = jobs.get(jobId);
            if (entry == null) {
                return CancelResult.notFound();
            }
            if (entry.state.isRemovable()) {
                jobs.remove(jobId);
                return CancelResult.removed();
            }
            if (entry.state == QueueState.ACTIVE) {
                return CancelResult.running();
            }
            return CancelResult.notFound();
        }
    }

    @Override
    public synchronized Optional<ClaimedJob> claimNext(String workerId, Duration lease) {
        Instant now = clock.instant();
        for (Entry entry : jobs.values()) {
            if (entry.state.isRemovable() && !entry.availableAt.isAfter(now)) {
                entry.state = QueueState.ACTIVE;
                entry.attempts++;
                entry.lockedBy = workerId;
                entry.lockedUntil = now.plus(lease);
                return Optional.of(new ClaimedJob(entry.job, entry.attempts));
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized void complete(String jobId) {
        finish(jobId, QueueState.COMPLETED);
    }

    @Override
    public synchronized void fail(String jobId, String reason) {
        log.debug("Job {} failed in queue: {}", jobId, reason);
        finish(jobId, QueueState.FAILED);
    }

    @Override
    public synchronized Optional<QueueState> state(String jobId) {
        Entry entry = jobs.get(jobId);
        return entry == null ? Optional.empty() : Optional.of(entry.state);
    }

    @Override
    public synchronized Map<QueueState, Long> counts() {
        var counts = new EnumMap<QueueState, Long>(QueueState.class);
        for (QueueState state : QueueState.values()) {
            counts.put(state, 0L);
        }
        for (Entry entry : jobs.values()) {
            counts.merge(entry.state, 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public synchronized int requeueStalled(int maxStalledCount) {
        Instant now = clock.instant();
        int requeued = 0;
        for (Entry entry : jobs.values()) {
            if (entry.state != QueueState.ACTIVE || entry.lockedUntil.isAfter(now)) {
                continue;
            }
            if (entry.attempts >= maxStalledCount) {
                log.warn("Job {} stalled {} times, failing it", entry.job.jobId(), entry.attempts);
                entry.state = QueueState.FAILED;
                entry.finishedAt = now;
            } else {
                log.warn("Job {} stalled on worker {}, requeueing", entry.job.jobId(), entry.lockedBy);
                entry.state = QueueState.WAITING;
                entry.availableAt = now;
                requeued++;
            }
            entry.lockedBy = null;
            entry.lockedUntil = null;
        }
        return requeued;
    }

    @Override
    public synchronized int purgeFinished(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int purged = 0;
        for (Iterator<Entry> it = jobs.values().iterator(); it.hasNext(); ) {
            Entry entry = it.next();
            if (entry.finishedAt != null && entry.finishedAt.isBefore(cutoff)) {
                it.remove();
                purged++;
            }
        }
        return purged;
    }

    private void finish(String jobId, QueueState state) {
        Entry entry = jobs.get(jobId);
        if (entry == null) {
            return;
        }
        entry.state = state;
        entry.finishedAt = clock.instant();
        entry.lockedBy = null;
        entry.lockedUntil = null;
    }

    private static final class Entry {
        private final CompileJob job;
        private QueueState state;
        private int attempts;
        private Instant availableAt;
        private String lockedBy;
        private Instant lockedUntil;
        private Instant finishedAt;

        private Entry(CompileJob job) {
            this.job = job;
        }
    }
}
