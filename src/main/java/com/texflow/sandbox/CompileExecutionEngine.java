package com.texflow.sandbox;

import com.texflow.core.cancel.CancellationRegistry;
import com.texflow.core.errors.TransientBrokerException;
import com.texflow.core.model.Engine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * Runs a single compile attempt inside a sandbox container.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Resolves {@code auto} to a concrete engine before anything is started</li>
 *   <li>Bounds concurrent containers per process with a semaphore</li>
 *   <li>Polls the {@link CancellationRegistry} around every phase and while waiting</li>
 *   <li>Kills the container on cancel or when the wall-clock ceiling is hit</li>
 *   <li>Treats the presence of the PDF as the only success signal</li>
 * </ul>
 */
@Service
public class CompileExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(CompileExecutionEngine.class);

    private static final long MAX_SOURCE_SNIFF_BYTES = 1024 * 1024;

    private final ContainerRuntime runtime;
    private final CancellationRegistry cancellationRegistry;
    private final String image;
    private final String containerWorkDir;
    private final long memoryBytes;
    private final long nanoCpus;
    private final long pidsLimit;
    private final long timeoutMs;
    private final long cancelPollIntervalMs;
    private final int maxConcurrent;
    private final Semaphore slots;

    @Autowired
    public CompileExecutionEngine(ContainerRuntime runtime, CancellationRegistry cancellationRegistry,
                                  SandboxProperties properties) {
        this(runtime, cancellationRegistry, properties.getImage(), properties.getContainerWorkDir(),
                properties.getMemoryBytes(), properties.getNanoCpus(), properties.getPidsLimit(),
                properties.getTimeoutMs(), properties.getCancelPollIntervalMs(), properties.getMaxConcurrent());
    }

    CompileExecutionEngine(ContainerRuntime runtime, CancellationRegistry cancellationRegistry,
                           String image, String containerWorkDir, long memoryBytes, long nanoCpus,
                           long pidsLimit, long timeoutMs, long cancelPollIntervalMs, int maxConcurrent) {
        this.runtime = runtime;
        this.cancellationRegistry = cancellationRegistry;
        this.image = image;
        this.containerWorkDir = containerWorkDir;
        this.memoryBytes = memoryBytes;
        this.nanoCpus = nanoCpus;
        this.pidsLimit = pidsLimit;
        this.timeoutMs = timeoutMs;
        this.cancelPollIntervalMs = Math.max(50, cancelPollIntervalMs);
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.slots = new Semaphore(this.maxConcurrent, true);
    }

    /**
     * Compiles {@code request.mainFile()} inside {@code request.workDir()}.
     *
     * @param onEngineResolved invoked with the concrete engine before the
     *                         container is created
     * @throws InterruptedException if interrupted while waiting for a slot
     */
    public ExecutionResult run(ExecutionRequest request, Consumer<Engine> onEngineResolved)
            throws InterruptedException {
        Engine engine = resolveEngine(request);
        onEngineResolved.accept(engine);

        slots.acquire();
        try {
            return execute(request, engine);
        } finally {
            slots.release();
        }
    }

    public Engine resolveEngine(ExecutionRequest request) {
        if (request.requestedEngine() != null && request.requestedEngine() != Engine.AUTO) {
            return request.requestedEngine();
        }
        Engine detected = EngineDetector.detect(readSource(request.workDir().resolve(request.mainFile())));
        log.debug("Auto-detected engine {} for job {}", detected.wireName(), request.jobId());
        return detected;
    }

    public boolean isImageAvailable() {
        return runtime.imageExists(image);
    }

    public boolean isRuntimeReachable() {
        return runtime.ping();
    }

    public String getImage() {
        return image;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getActiveCount() {
        return maxConcurrent - slots.availablePermits();
    }

    private ExecutionResult execute(ExecutionRequest request, Engine engine) {
        long start = System.currentTimeMillis();
        String jobId = request.jobId();

        if (cancelRequested(jobId)) {
            log.info("Job {} canceled before container creation", jobId);
            return canceled(engine, "", start);
        }

        String containerId = null;
        try {
            containerId = runtime.createContainer(containerSpec(request, engine));
            if (cancelRequested(jobId)) {
                log.info("Job {} canceled after container creation", jobId);
                return canceled(engine, "", start);
            }

            runtime.startContainer(containerId);
            if (cancelRequested(jobId)) {
                runtime.kill(containerId);
                log.info("Job {} canceled right after container start", jobId);
                return canceled(engine, runtime.captureOutput(containerId), start);
            }

            long deadline = start + timeoutMs;
            Integer exitCode = null;
            boolean timedOut = false;
            boolean canceled = false;
            while (true) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    timedOut = true;
                    runtime.kill(containerId);
                    log.warn("Job {} exceeded {}ms, container killed", jobId, timeoutMs);
                    break;
                }
                exitCode = runtime.awaitExit(containerId, Math.min(cancelPollIntervalMs, remaining));
                if (cancelRequested(jobId)) {
                    canceled = true;
                    if (exitCode == null) {
                        runtime.kill(containerId);
                    }
                    log.info("Job {} canceled while compiling", jobId);
                    break;
                }
                if (exitCode != null) {
                    break;
                }
            }

            String logs = runtime.captureOutput(containerId);
            long durationMs = System.currentTimeMillis() - start;
            if (canceled) {
                return new ExecutionResult(logs, -1, false, false, true, engine, null, durationMs);
            }
            if (timedOut) {
                String timeoutLine = "[Timeout] Compilation exceeded " + (timeoutMs / 1000.0)
                        + "s and was terminated.";
                return new ExecutionResult(appendLine(logs, timeoutLine), -1, false, true, false,
                        engine, null, durationMs);
            }

            Path pdf = request.workDir().resolve(request.pdfFileName());
            Path pdfPath = isNonEmptyFile(pdf) ? pdf : null;
            return new ExecutionResult(logs, exitCode, exitCode == 0, false, false, engine, pdfPath, durationMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (containerId != null) {
                runtime.kill(containerId);
            }
            log.warn("Interrupted while compiling job {}", jobId);
            return containerError(engine, "interrupted", start);
        } catch (RuntimeException e) {
            log.error("Container error for job {}", jobId, e);
            return containerError(engine, e.getMessage(), start);
        } finally {
            if (containerId != null) {
                runtime.remove(containerId);
            }
        }
    }

    private ContainerSpec containerSpec(ExecutionRequest request, Engine engine) {
        var command = List.of("latexmk", engine.latexmkFlag(), "-gg",
                "-interaction=nonstopmode", "-halt-on-error", "-file-line-error", request.mainFile());
        return new ContainerSpec(
                containerName(request.jobId()),
                image,
                command,
                request.workDir(),
                containerWorkDir,
                memoryBytes,
                nanoCpus,
                pidsLimit,
                Map.of("texflow.job-id", request.jobId(), "texflow.engine", engine.wireName()));
    }

    private boolean cancelRequested(String jobId) {
        try {
            return cancellationRegistry.isCanceled(jobId);
        } catch (TransientBrokerException e) {
            log.warn("Cancel check failed for job {}, continuing: {}", jobId, e.getMessage());
            return false;
        }
    }

    private static ExecutionResult canceled(Engine engine, String logs, long start) {
        return new ExecutionResult(logs, -1, false, false, true, engine, null,
                System.currentTimeMillis() - start);
    }

    private static ExecutionResult containerError(Engine engine, String detail, long start) {
        String reason = detail != null ? detail : "unknown error";
        return new ExecutionResult("[Docker] Container error: " + reason, -1, false, false, false,
                engine, null, System.currentTimeMillis() - start, reason);
    }

    static String containerName(String jobId) {
        return "texflow-compile-" + jobId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_.-]", "-");
    }

    private static String appendLine(String logs, String line) {
        if (logs == null || logs.isEmpty()) {
            return line;
        }
        return logs.endsWith("\n") ? logs + line : logs + "\n" + line;
    }

    private static boolean isNonEmptyFile(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private static String readSource(Path mainFile) {
        try {
            if (!Files.isRegularFile(mainFile)) {
                return "";
            }
            byte[] bytes;
            try (var in = Files.newInputStream(mainFile)) {
                bytes = in.readNBytes((int) MAX_SOURCE_SNIFF_BYTES);
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {} for engine detection: {}", mainFile, e.getMessage());
            return "";
        }
    }
}
