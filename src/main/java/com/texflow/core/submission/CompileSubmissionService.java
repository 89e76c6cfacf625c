package com.texflow.core.submission;

import com.texflow.core.ephemeral.EphemeralJobRecord;
import com.texflow.core.ephemeral.EphemeralJobStore;
import com.texflow.core.ephemeral.StorageProperties;
import com.texflow.core.errors.InfrastructureUnavailableException;
import com.texflow.core.errors.TransientBrokerException;
import com.texflow.core.errors.ValidationException;
import com.texflow.core.events.StatusPublisher;
import com.texflow.core.health.DeploymentMode;
import com.texflow.core.health.WorkerHealthCheck;
import com.texflow.core.metrics.TexflowMetrics;
import com.texflow.core.model.CompileJob;
import com.texflow.core.model.Engine;
import com.texflow.core.model.JobKind;
import com.texflow.core.model.JobStatus;
import com.texflow.core.model.JobStatusChange;
import com.texflow.core.queue.CancelResult;
import com.texflow.core.queue.JobQueue;
import com.texflow.core.worker.ProjectPersistenceHook;
import com.texflow.sandbox.CompileExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for callers that want something compiled. Validates the
 * request, refuses it when nothing could run it, then records and enqueues
 * it. Never waits on the compile itself.
 */
@Service
public class CompileSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(CompileSubmissionService.class);

    static final String WORKER_UNAVAILABLE = "Compilation worker unavailable, try again shortly";

    private final JobQueue queue;
    private final EphemeralJobStore store;
    private final StatusPublisher publisher;
    private final WorkerHealthCheck workerHealth;
    private final CompileExecutionEngine engine;
    private final ProjectPersistenceHook projectHook;
    private final int maxSourceBytes;
    private final TexflowMetrics metrics;

    @Autowired
    public CompileSubmissionService(JobQueue queue,
                                    EphemeralJobStore store,
                                    StatusPublisher publisher,
                                    WorkerHealthCheck workerHealth,
                                    CompileExecutionEngine engine,
                                    ProjectPersistenceHook projectHook,
                                    StorageProperties storageProperties,
                                    @Autowired(required = false) TexflowMetrics metrics) {
        this(queue, store, publisher, workerHealth, engine, projectHook,
                storageProperties.getMaxSourceBytes(), metrics);
    }

    CompileSubmissionService(JobQueue queue, EphemeralJobStore store, StatusPublisher publisher,
                             WorkerHealthCheck workerHealth, CompileExecutionEngine engine,
                             ProjectPersistenceHook projectHook, int maxSourceBytes, TexflowMetrics metrics) {
        this.queue = queue;
        this.store = store;
        this.publisher = publisher;
        this.workerHealth = workerHealth;
        this.engine = engine;
        this.projectHook = projectHook;
        this.maxSourceBytes = maxSourceBytes;
        this.metrics = metrics;
    }

    // --- One-shot compiles ---

    /**
     * Stores inline LaTeX source and queues it for compilation.
     *
     * @throws ValidationException if the source or engine is unacceptable
     * @throws InfrastructureUnavailableException if no worker could run it
     * @throws TransientBrokerException if the queue could not be reached; nothing is left behind
     */
    public EphemeralJobRecord submitEphemeral(String source, String engineName, String userId) {
        validateSource(source);
        Engine requested = parseEngine(engineName);
        preflight();

        String jobId = UUID.randomUUID().toString();
        EphemeralJobRecord record = store.create(jobId, userId, requested, CompileJob.DEFAULT_MAIN_FILE, source);
        CompileJob job = new CompileJob(jobId, JobKind.EPHEMERAL, store.jobDirectory(jobId).toString(),
                CompileJob.DEFAULT_MAIN_FILE, requested, null, userId, record.createdAt());
        try {
            queue.enqueue(job);
        } catch (RuntimeException e) {
            store.delete(jobId);
            log.warn("Enqueue of ephemeral job {} failed, record rolled back: {}", jobId, e.getMessage());
            if (e instanceof TransientBrokerException tbe) {
                throw tbe;
            }
            throw new TransientBrokerException("Failed to enqueue compile job", e);
        }

        publisher.publishStatus(job, JobStatus.QUEUED);
        if (metrics != null) {
            metrics.recordEnqueued("ephemeral");
        }
        log.info("Queued ephemeral compile {} (engine={}, {} bytes)", jobId, requested.wireName(),
                source.getBytes(StandardCharsets.UTF_8).length);
        return record;
    }

    public Optional<EphemeralJobRecord> poll(String jobId) {
        if (!EphemeralJobStore.isValidJobId(jobId)) {
            return Optional.empty();
        }
        return store.read(jobId);
    }

    /**
     * Cancels a one-shot compile. A job still waiting is removed and finished
     * here; a running one is flagged and finished by its worker.
     *
     * @return empty when the job is unknown or expired
     */
    public Optional<CancelOutcome> cancelEphemeral(String jobId) {
        Optional<EphemeralJobRecord> current = poll(jobId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        EphemeralJobRecord record = current.get();
        if (record.isTerminal()) {
            return Optional.of(CancelOutcome.alreadyFinished(jobId, record.status()));
        }

        CancelResult result = requestCancel(jobId);
        if (result.wasQueued() && !result.wasRunning()) {
            JobStatusChange change = JobStatusChange.canceledBeforeStart(jobId, Instant.now());
            store.patch(jobId, change);
            publisher.publishComplete(ephemeralJob(record), change, null);
        }
        return Optional.of(CancelOutcome.accepted(jobId));
    }

    // --- Project builds ---

    public CompileJob submitBuild(BuildRequest request) {
        Path projectDir = validateProjectDir(request.projectDir());
        String mainFile = validateMainFile(request.mainFile());
        Engine requested = parseEngine(request.engine());
        String buildId = request.buildId() == null || request.buildId().isBlank()
                ? UUID.randomUUID().toString()
                : request.buildId();
        if (!EphemeralJobStore.isValidJobId(buildId)) {
            throw new ValidationException("Invalid build id: " + buildId);
        }
        preflight();

        CompileJob job = new CompileJob(buildId, JobKind.PROJECT, projectDir.toString(), mainFile, requested,
                request.projectId(), request.triggeredBy(), Instant.now());
        boolean created = queue.enqueue(job);
        if (!created) {
            log.info("Build {} already known to the queue, not enqueued again", buildId);
            return job;
        }
        publisher.publishStatus(job, JobStatus.QUEUED);
        if (metrics != null) {
            metrics.recordEnqueued("project");
        }
        log.info("Queued build {} of {} (main={}, engine={})", buildId, projectDir, mainFile, requested.wireName());
        return job;
    }

    /**
     * Cancels a project build. When the build was still waiting, the
     * canceled transition is reported through the project hook here.
     */
    public CancelResult cancelBuild(String buildId) {
        CancelResult result = requestCancel(buildId);
        if (result.wasQueued() && !result.wasRunning()) {
            JobStatusChange change = JobStatusChange.canceledBeforeStart(buildId, Instant.now());
            projectHook.onStatusChange(change);
            publisher.publishComplete(new CompileJob(buildId, JobKind.PROJECT, "", null, null, null, null, null),
                    change, null);
        }
        return result;
    }

    // --- Validation ---

    /**
     * Refuses work that would only fail later. Dedicated topologies need a
     * fresh worker heartbeat; embedded ones need the in-process worker, the
     * container runtime and the compiler image.
     */
    public void preflight() {
        if (!workerHealth.isAvailable()) {
            throw new InfrastructureUnavailableException(WORKER_UNAVAILABLE);
        }
        if (workerHealth.mode() == DeploymentMode.DEDICATED) {
            return;
        }
        if (!engine.isRuntimeReachable()) {
            throw new InfrastructureUnavailableException("Container runtime is not reachable");
        }
        if (!engine.isImageAvailable()) {
            throw new InfrastructureUnavailableException("Compiler image " + engine.getImage() + " is not available");
        }
    }

    public static Engine parseEngine(String name) {
        if (name == null || name.isBlank()) {
            return Engine.AUTO;
        }
        return Engine.fromName(name).orElseThrow(() -> new ValidationException(
                "Unknown engine '" + name + "'. Supported engines: " + Arrays.stream(Engine.values())
                        .map(Engine::wireName)
                        .collect(Collectors.joining(", "))));
    }

    void validateSource(String source) {
        if (source == null || source.isBlank()) {
            throw new ValidationException("LaTeX source is required");
        }
        int size = source.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxSourceBytes) {
            throw new ValidationException("LaTeX source is " + size + " bytes; the limit is " + maxSourceBytes);
        }
    }

    static Path validateProjectDir(String projectDir) {
        if (projectDir == null || projectDir.isBlank()) {
            throw new ValidationException("projectDir is required");
        }
        Path path = Path.of(projectDir);
        if (!path.isAbsolute()) {
            throw new ValidationException("projectDir must be an absolute path");
        }
        for (Path segment : path) {
            if ("..".equals(segment.toString())) {
                throw new ValidationException("projectDir must not contain '..' segments");
            }
        }
        if (!Files.isDirectory(path)) {
            throw new ValidationException("projectDir does not exist: " + projectDir);
        }
        return path.normalize();
    }

    static String validateMainFile(String mainFile) {
        if (mainFile == null || mainFile.isBlank()) {
            return CompileJob.DEFAULT_MAIN_FILE;
        }
        Path path = Path.of(mainFile);
        if (path.isAbsolute() || !mainFile.endsWith(".tex")) {
            throw new ValidationException("mainFile must be a relative .tex path");
        }
        for (Path segment : path) {
            if ("..".equals(segment.toString())) {
                throw new ValidationException("mainFile must not contain '..' segments");
            }
        }
        return mainFile;
    }

    private CancelResult requestCancel(String jobId) {
        CancelResult result = queue.requestCancel(jobId);
        if (metrics != null) {
            metrics.recordCancelRequest(outcomeOf(result));
        }
        if (!result.confirmed()) {
            throw new TransientBrokerException("Could not confirm cancellation of " + jobId + ", try again", null);
        }
        log.info("Cancel requested for {} (wasQueued={}, wasRunning={})",
                jobId, result.wasQueued(), result.wasRunning());
        return result;
    }

    private CompileJob ephemeralJob(EphemeralJobRecord record) {
        return new CompileJob(record.id(), JobKind.EPHEMERAL, store.jobDirectory(record.id()).toString(),
                record.mainFile(), record.requestedEngine(), null, record.userId(), record.createdAt());
    }

    private static String outcomeOf(CancelResult result) {
        if (!result.confirmed()) {
            return "unconfirmed";
        }
        if (result.wasQueued()) {
            return "removed";
        }
        return result.wasRunning() ? "running" : "not_found";
    }
}
