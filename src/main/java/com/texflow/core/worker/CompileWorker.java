package com.texflow.core.worker;

import com.texflow.core.cancel.CancellationRegistry;
import com.texflow.core.errors.TransientBrokerException;
import com.texflow.core.events.StatusPublisher;
import com.texflow.core.logging.MdcContext;
import com.texflow.core.logparser.LatexLogParser;
import com.texflow.core.logparser.LogSummary;
import com.texflow.core.metrics.TexflowMetrics;
import com.texflow.core.model.CompileJob;
import com.texflow.core.model.Engine;
import com.texflow.core.model.JobKind;
import com.texflow.core.model.JobStatus;
import com.texflow.core.model.JobStatusChange;
import com.texflow.core.model.ParsedLogEntry;
import com.texflow.core.queue.ClaimedJob;
import com.texflow.core.queue.JobQueue;
import com.texflow.sandbox.CompileExecutionEngine;
import com.texflow.sandbox.ExecutionRequest;
import com.texflow.sandbox.ExecutionResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pulls compile jobs off the {@link JobQueue} and drives each one through
 * {@code compiling} to a terminal status.
 * <p>
 * One claim loop runs per container slot. For every job the worker owns the
 * full lifecycle: persist through the job kind's hook, broadcast through the
 * {@link StatusPublisher}, then acknowledge the queue. The same class backs
 * both the embedded topology (started with the web server) and the dedicated
 * worker process.
 */
@Service
public class CompileWorker {

    private static final Logger log = LoggerFactory.getLogger(CompileWorker.class);

    static final String CANCELED_MESSAGE = "Build canceled by user.";

    private final JobQueue queue;
    private final CompileExecutionEngine engine;
    private final CancellationRegistry cancellationRegistry;
    private final EphemeralJobPersistence ephemeralPersistence;
    private final ProjectPersistenceHook projectHook;
    private final StatusPublisher publisher;
    private final WorkspaceStager stager;
    private final WorkerProperties properties;
    private final TexflowMetrics metrics;

    private final AtomicInteger activeJobs = new AtomicInteger();
    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();

    private volatile boolean running;
    private volatile long startedAtMs;
    private ExecutorService loops;
    private ScheduledExecutorService healthLogger;

    public CompileWorker(JobQueue queue,
                         CompileExecutionEngine engine,
                         CancellationRegistry cancellationRegistry,
                         EphemeralJobPersistence ephemeralPersistence,
                         ProjectPersistenceHook projectHook,
                         StatusPublisher publisher,
                         WorkspaceStager stager,
                         WorkerProperties properties,
                         @Autowired(required = false) TexflowMetrics metrics) {
        this.queue = queue;
        this.engine = engine;
        this.cancellationRegistry = cancellationRegistry;
        this.ephemeralPersistence = ephemeralPersistence;
        this.projectHook = projectHook;
        this.publisher = publisher;
        this.stager = stager;
        this.properties = properties;
        this.metrics = metrics;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        int slots = engine.getMaxConcurrent();
        running = true;
        startedAtMs = System.currentTimeMillis();

        AtomicInteger threadCounter = new AtomicInteger();
        loops = Executors.newFixedThreadPool(slots, r -> {
            Thread t = new Thread(r, "compile-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < slots; i++) {
            loops.submit(this::claimLoop);
        }

        healthLogger = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "compile-worker-health");
            t.setDaemon(true);
            return t;
        });
        long interval = properties.getHealthLogIntervalMs();
        healthLogger.scheduleAtFixedRate(this::logHealth, interval, interval, TimeUnit.MILLISECONDS);

        log.info("Compile worker {} started with {} slot(s), image={}, timeout={}ms",
                properties.getInstanceId(), slots, engine.getImage(), engine.getTimeoutMs());
    }

    @PreDestroy
    public void stop() {
        ExecutorService pool;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            pool = loops;
            loops = null;
            if (healthLogger != null) {
                healthLogger.shutdownNow();
                healthLogger = null;
            }
        }
        log.info("Stopping compile worker {} ({} job(s) in flight)", properties.getInstanceId(), activeJobs.get());
        pool.shutdown();
        try {
            // In-flight compiles get their full timeout; abandoned leases are requeued by maintenance.
            if (!pool.awaitTermination(engine.getTimeoutMs() + 5_000, TimeUnit.MILLISECONDS)) {
                log.warn("Compile worker did not drain in time, interrupting remaining jobs");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Compile worker {} stopped", properties.getInstanceId());
    }

    public boolean isRunning() {
        return running;
    }

    public WorkerStats stats() {
        long uptime = running ? System.currentTimeMillis() - startedAtMs : 0L;
        return new WorkerStats(running, activeJobs.get(), engine.getMaxConcurrent(),
                totalProcessed.get(), totalErrors.get(), uptime);
    }

    /**
     * Claims and processes at most one job on the calling thread.
     *
     * @return true if a job was claimed
     */
    public boolean pollOnce() {
        Duration lease = Duration.ofMillis(engine.getTimeoutMs() + properties.getLeaseMarginMs());
        Optional<ClaimedJob> claimed = queue.claimNext(properties.getInstanceId(), lease);
        claimed.ifPresent(this::process);
        return claimed.isPresent();
    }

    private void claimLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                if (!pollOnce()) {
                    Thread.sleep(properties.getIdlePollIntervalMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (TransientBrokerException e) {
                log.warn("Queue unavailable, backing off: {}", e.getMessage());
                sleepQuietly(properties.getIdlePollIntervalMs());
            } catch (RuntimeException e) {
                log.error("Unexpected error in claim loop", e);
                sleepQuietly(properties.getIdlePollIntervalMs());
            }
        }
    }

    /**
     * Runs one claimed job to a terminal status.
     *
     * @return the terminal transition, or empty when the job was a redelivery of an already finished one
     */
    Optional<JobStatusChange> process(ClaimedJob claimed) {
        CompileJob job = claimed.job();
        MdcContext.setWorker(properties.getInstanceId());
        MdcContext.setJob(job.jobId(), job.kind().name().toLowerCase());
        activeJobs.incrementAndGet();
        try {
            if (claimed.attempts() > 1) {
                log.info("Job {} redelivered (attempt {})", job.jobId(), claimed.attempts());
            }
            return handle(job);
        } finally {
            activeJobs.decrementAndGet();
            MdcContext.clear();
        }
    }

    private Optional<JobStatusChange> handle(CompileJob job) {
        JobPersistenceHook hook = hookFor(job);

        if (job.kind() == JobKind.EPHEMERAL && ephemeralPersistence.isAlreadyFinished(job.jobId())) {
            log.info("Job {} already finished, acknowledging", job.jobId());
            queue.complete(job.jobId());
            return Optional.empty();
        }

        if (isCanceled(job.jobId())) {
            JobStatusChange change = JobStatusChange.canceledBeforeStart(job.jobId(), Instant.now());
            finish(job, hook, change, null);
            queue.complete(job.jobId());
            log.info("Job {} was canceled before it started", job.jobId());
            return Optional.of(change);
        }

        Instant startedAt = Instant.now();
        long startMs = System.currentTimeMillis();
        persist(hook, JobStatusChange.compiling(job.jobId(), startedAt, null));
        publisher.publishStatus(job, JobStatus.COMPILING);

        Path workDir = null;
        Engine resolved = null;
        try {
            workDir = stager.prepare(job);
            ExecutionResult result = engine.run(ExecutionRequest.of(job, workDir), engineUsed -> {
                MdcContext.setEngine(engineUsed.wireName());
                persist(hook, JobStatusChange.compiling(job.jobId(), startedAt, engineUsed));
            });
            resolved = result.engineUsed();
            if (result.isContainerFailure()) {
                log.error("Container runtime failed for job {}: {}", job.jobId(), result.containerError());
                return Optional.of(failInfrastructure(job, hook, resolved, result.containerError(), startMs));
            }

            List<ParsedLogEntry> entries = LatexLogParser.parse(result.logs());
            LogSummary summary = LatexLogParser.summarize(entries);
            JobStatus status = resolveStatus(result, summary);

            String pdfRef = status == JobStatus.SUCCESS ? stager.publishPdf(job, result.pdfPath()) : null;
            String logs = status == JobStatus.CANCELED ? appendLine(result.logs(), CANCELED_MESSAGE) : result.logs();

            JobStatusChange change = new JobStatusChange(job.jobId(), status, result.engineUsed(), logs,
                    result.exitCode(), result.durationMs(), startedAt, Instant.now(),
                    messageFor(status, result, summary), entries,
                    status == JobStatus.SUCCESS ? pdfRef : null);
            finish(job, hook, change, pdfRef);
            queue.complete(job.jobId());

            if (metrics != null) {
                metrics.recordCompileDuration(result.engineUsed().wireName(), result.durationMs());
                metrics.recordLogEntries(summary.errors(), summary.warnings());
            }
            if (status == JobStatus.ERROR || status == JobStatus.TIMEOUT) {
                totalErrors.incrementAndGet();
            }
            log.info("Job {} finished: status={} engine={} exitCode={} duration={}ms errors={} warnings={}",
                    job.jobId(), status.wireName(), result.engineUsed().wireName(), result.exitCode(),
                    result.durationMs(), summary.errors(), summary.warnings());
            return Optional.of(change);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.of(failInfrastructure(job, hook, resolved, "worker interrupted", startMs));
        } catch (RuntimeException e) {
            log.error("Infrastructure failure while compiling job {}", job.jobId(), e);
            return Optional.of(failInfrastructure(job, hook, resolved, e.getMessage(), startMs));
        } finally {
            stager.cleanup(job, workDir);
        }
    }

    /**
     * Terminal status precedence: canceled, then timeout, then error
     * (non-zero exit, parsed errors, or no PDF), then success.
     */
    static JobStatus resolveStatus(ExecutionResult result, LogSummary summary) {
        if (result.canceled()) {
            return JobStatus.CANCELED;
        }
        if (result.timedOut()) {
            return JobStatus.TIMEOUT;
        }
        if (result.exitCode() != 0 || summary.hasErrors() || !result.hasPdf()) {
            return JobStatus.ERROR;
        }
        return JobStatus.SUCCESS;
    }

    static String messageFor(JobStatus status, ExecutionResult result, LogSummary summary) {
        return switch (status) {
            case SUCCESS -> summary.warnings() > 0
                    ? "Compilation succeeded with " + summary.warnings() + " warning(s)"
                    : "Compilation succeeded";
            case CANCELED -> CANCELED_MESSAGE;
            case TIMEOUT -> "Compilation timed out after " + (result.durationMs() / 1000) + "s";
            case ERROR -> {
                if (summary.hasErrors()) {
                    yield "Compilation failed with " + summary.errors() + " error(s)";
                }
                if (result.exitCode() != 0) {
                    yield "Compilation failed with exit code " + result.exitCode();
                }
                yield "Compilation failed: no PDF was produced";
            }
            default -> null;
        };
    }

    private JobStatusChange failInfrastructure(CompileJob job, JobPersistenceHook hook, Engine engineUsed,
                                               String detail, long startMs) {
        String reason = detail != null ? detail : "unknown error";
        JobStatusChange change = JobStatusChange.infrastructureError(job.jobId(), engineUsed, reason,
                System.currentTimeMillis() - startMs, Instant.now());
        finish(job, hook, change, null);
        try {
            queue.fail(job.jobId(), reason);
        } catch (RuntimeException e) {
            log.warn("Could not mark job {} failed on the queue: {}", job.jobId(), e.getMessage());
        }
        totalErrors.incrementAndGet();
        return change;
    }

    private void finish(CompileJob job, JobPersistenceHook hook, JobStatusChange change, String pdfUrl) {
        persist(hook, change);
        publisher.publishComplete(job, change, pdfUrl);
        totalProcessed.incrementAndGet();
        if (metrics != null) {
            metrics.recordJobResult(change.status().wireName());
        }
        clearCancelMarker(job.jobId());
    }

    private void clearCancelMarker(String jobId) {
        try {
            cancellationRegistry.clear(jobId);
        } catch (TransientBrokerException e) {
            log.warn("Could not clear cancel marker for job {}, it will expire: {}", jobId, e.getMessage());
        }
    }

    private void persist(JobPersistenceHook hook, JobStatusChange change) {
        try {
            hook.onStatusChange(change);
        } catch (RuntimeException e) {
            log.error("Persisting {} for job {} failed", change.status().wireName(), change.jobId(), e);
        }
    }

    private JobPersistenceHook hookFor(CompileJob job) {
        return job.kind() == JobKind.EPHEMERAL ? ephemeralPersistence : projectHook;
    }

    private boolean isCanceled(String jobId) {
        try {
            return cancellationRegistry.isCanceled(jobId);
        } catch (TransientBrokerException e) {
            log.warn("Cancellation check for job {} failed, continuing: {}", jobId, e.getMessage());
            return false;
        }
    }

    private void logHealth() {
        WorkerStats stats = stats();
        log.info("Worker health: active={}/{} processed={} errors={} uptime={}s",
                stats.activeJobs(), stats.maxConcurrent(), stats.totalProcessed(), stats.totalErrors(),
                stats.uptimeMs() / 1000);
    }

    private static String appendLine(String logs, String line) {
        if (logs == null || logs.isBlank()) {
            return line;
        }
        return logs.endsWith("\n") ? logs + line : logs + "\n" + line;
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
