package com.texflow.core.submission;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.texflow.core.cancel.InMemoryCancellationRegistry;
import com.texflow.core.ephemeral.EphemeralJobRecord;
import com.texflow.core.ephemeral.EphemeralJobStore;
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
import com.texflow.core.queue.InMemoryJobQueue;
import com.texflow.core.queue.JobQueue;
import com.texflow.core.queue.QueueState;
import com.texflow.core.worker.ProjectPersistenceHook;
import com.texflow.sandbox.CompileExecutionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CompileSubmissionServiceTest {

    private static final String SOURCE = "\\documentclass{article}\\begin{document}x\\end{document}";

    @TempDir
    Path tempDir;

    private InMemoryJobQueue queue;
    private EphemeralJobStore store;
    private StatusPublisher publisher;
    private WorkerHealthCheck workerHealth;
    private CompileExecutionEngine engine;
    private ProjectPersistenceHook projectHook;
    private TexflowMetrics metrics;
    private CompileSubmissionService service;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue(new InMemoryCancellationRegistry(), Duration.ofMinutes(15));
        store = new EphemeralJobStore(tempDir.resolve("storage"), Duration.ofMinutes(60),
                new ObjectMapper().findAndRegisterModules(), Clock.systemUTC());
        publisher = mock(StatusPublisher.class);
        workerHealth = mock(WorkerHealthCheck.class);
        engine = mock(CompileExecutionEngine.class);
        projectHook = mock(ProjectPersistenceHook.class);
        metrics = mock(TexflowMetrics.class);
        when(workerHealth.mode()).thenReturn(DeploymentMode.EMBEDDED);
        when(workerHealth.isAvailable()).thenReturn(true);
        when(engine.isRuntimeReachable()).thenReturn(true);
        when(engine.isImageAvailable()).thenReturn(true);
        when(engine.getImage()).thenReturn("texflow-compiler:latest");
        service = newService(queue);
    }

    private CompileSubmissionService newService(JobQueue jobQueue) {
        return new CompileSubmissionService(jobQueue, store, publisher, workerHealth, engine, projectHook,
                1024, metrics);
    }

    @Nested
    @DisplayName("one-shot submission")
    class Submit {

        @Test
        void validSourceIsStoredAndQueued() throws Exception {
            EphemeralJobRecord record = service.submitEphemeral(SOURCE, "XeLaTeX", "user-1");

            assertEquals(JobStatus.QUEUED, record.status());
            assertEquals(Engine.XELATEX, record.requestedEngine());
            assertEquals("user-1", record.userId());
            assertEquals(Optional.of(QueueState.WAITING), queue.state(record.id()));
            assertEquals(SOURCE, Files.readString(store.jobDirectory(record.id()).resolve("main.tex")));

            var job = ArgumentCaptor.forClass(CompileJob.class);
            verify(publisher).publishStatus(job.capture(), eq(JobStatus.QUEUED));
            assertEquals(JobKind.EPHEMERAL, job.getValue().kind());
            assertEquals(store.jobDirectory(record.id()).toString(), job.getValue().sourceLocation());
            verify(metrics).recordEnqueued("ephemeral");
        }

        @Test
        void blankEngineMeansAuto() {
            assertEquals(Engine.AUTO, service.submitEphemeral(SOURCE, " ", null).requestedEngine());
        }

        @Test
        void invalidInputIsRejected() {
            assertThrows(ValidationException.class, () -> service.submitEphemeral("  ", null, null));
            assertThrows(ValidationException.class, () -> service.submitEphemeral("x".repeat(1025), null, null));
            var ex = assertThrows(ValidationException.class, () -> service.submitEphemeral(SOURCE, "context", null));
            assertTrue(ex.getMessage().contains("pdflatex, xelatex, lualatex, latex"));
            assertTrue(queue.counts().values().stream().allMatch(c -> c == 0L));
        }

        @Test
        void unavailableWorkerFailsFastAndLeavesNothing() {
            when(workerHealth.isAvailable()).thenReturn(false);

            var ex = assertThrows(InfrastructureUnavailableException.class,
                    () -> service.submitEphemeral(SOURCE, null, null));

            assertEquals(CompileSubmissionService.WORKER_UNAVAILABLE, ex.getMessage());
            assertFalse(Files.exists(tempDir.resolve("storage/async-compiles")));
            verifyNoInteractions(publisher);
        }

        @Test
        void embeddedModeRequiresRuntimeAndImage() {
            when(engine.isImageAvailable()).thenReturn(false);
            var ex = assertThrows(InfrastructureUnavailableException.class,
                    () -> service.submitEphemeral(SOURCE, null, null));
            assertTrue(ex.getMessage().contains("texflow-compiler:latest"));

            when(engine.isRuntimeReachable()).thenReturn(false);
            assertThrows(InfrastructureUnavailableException.class, () -> service.submitEphemeral(SOURCE, null, null));
        }

        @Test
        void dedicatedModeTrustsHeartbeatOnly() {
            when(workerHealth.mode()).thenReturn(DeploymentMode.DEDICATED);
            when(engine.isRuntimeReachable()).thenReturn(false);

            assertDoesNotThrow(() -> service.submitEphemeral(SOURCE, null, null));
            verify(engine, never()).isRuntimeReachable();
        }

        @Test
        void enqueueFailureRollsBackRecord() throws Exception {
            JobQueue failing = mock(JobQueue.class);
            when(failing.enqueue(any())).thenThrow(new TransientBrokerException("db down", null));

            assertThrows(TransientBrokerException.class,
                    () -> newService(failing).submitEphemeral(SOURCE, null, null));

            try (var dirs = Files.list(tempDir.resolve("storage/async-compiles"))) {
                assertEquals(0, dirs.count());
            }
            verifyNoInteractions(publisher);
        }
    }

    @Nested
    @DisplayName("one-shot cancel")
    class Cancel {

        @Test
        void queuedJobIsCanceledImmediately() {
            String jobId = service.submitEphemeral(SOURCE, null, null).id();

            CancelOutcome outcome = service.cancelEphemeral(jobId).orElseThrow();

            assertTrue(outcome.accepted());
            assertEquals(JobStatus.CANCELED, outcome.status());
            var record = service.poll(jobId).orElseThrow();
            assertEquals(JobStatus.CANCELED, record.status());
            assertEquals("Build canceled before starting.", record.message());
            assertTrue(queue.state(jobId).isEmpty());
            verify(publisher).publishComplete(any(), argThat(c -> c.status() == JobStatus.CANCELED), isNull());
            verify(metrics).recordCancelRequest("removed");
        }

        @Test
        void runningJobIsFlaggedForTheWorker() {
            String jobId = service.submitEphemeral(SOURCE, null, null).id();
            queue.claimNext("w1", Duration.ofMinutes(5));
            store.patch(jobId, JobStatusChange.compiling(jobId, Instant.now(), Engine.PDFLATEX));

            CancelOutcome outcome = service.cancelEphemeral(jobId).orElseThrow();

            assertTrue(outcome.accepted());
            assertEquals(JobStatus.COMPILING, service.poll(jobId).orElseThrow().status());
            verify(publisher, never()).publishComplete(any(), any(), any());
            verify(metrics).recordCancelRequest("running");
        }

        @Test
        void finishedJobIsReportedNotCanceled() {
            String jobId = service.submitEphemeral(SOURCE, null, null).id();
            service.cancelEphemeral(jobId);

            CancelOutcome second = service.cancelEphemeral(jobId).orElseThrow();

            assertFalse(second.accepted());
            assertEquals(JobStatus.CANCELED, second.status());
            assertEquals("Compile job already completed", second.message());
        }

        @Test
        void unknownJobIsEmpty() {
            assertTrue(service.cancelEphemeral("nope").isEmpty());
            assertTrue(service.cancelEphemeral("../../etc").isEmpty());
        }

        @Test
        void unconfirmedCancelIsTransient() {
            String jobId = service.submitEphemeral(SOURCE, null, null).id();
            JobQueue failing = mock(JobQueue.class);
            when(failing.requestCancel(jobId)).thenReturn(CancelResult.unconfirmed());

            assertThrows(TransientBrokerException.class, () -> newService(failing).cancelEphemeral(jobId));
            assertEquals(JobStatus.QUEUED, service.poll(jobId).orElseThrow().status());
            verify(metrics).recordCancelRequest("unconfirmed");
        }
    }

    @Nested
    @DisplayName("project builds")
    class Builds {

        @Test
        void buildIsQueuedOnce() throws Exception {
            Path project = Files.createDirectories(tempDir.resolve("project"));
            var request = new BuildRequest("build-1", project.toString(), "thesis.tex", "lualatex", "p1", "u1");

            CompileJob job = service.submitBuild(request);
            service.submitBuild(request);

            assertEquals(JobKind.PROJECT, job.kind());
            assertEquals("thesis.tex", job.mainFile());
            assertEquals(Engine.LUALATEX, job.requestedEngine());
            assertEquals(Optional.of(QueueState.WAITING), queue.state("build-1"));
            verify(publisher, times(1)).publishStatus(any(), eq(JobStatus.QUEUED));
        }

        @Test
        void generatedIdWhenBlank() throws Exception {
            Path project = Files.createDirectories(tempDir.resolve("project"));

            CompileJob job = service.submitBuild(new BuildRequest(null, project.toString(), null, null, null, null));

            assertTrue(EphemeralJobStore.isValidJobId(job.jobId()));
            assertEquals("main.tex", job.mainFile());
        }

        @Test
        void unsafePathsAreRejected() throws Exception {
            Path project = Files.createDirectories(tempDir.resolve("project"));
            String dir = project.toString();

            assertThrows(ValidationException.class,
                    () -> service.submitBuild(new BuildRequest(null, "relative/dir", null, null, null, null)));
            assertThrows(ValidationException.class,
                    () -> service.submitBuild(new BuildRequest(null, dir + "/../project", null, null, null, null)));
            assertThrows(ValidationException.class,
                    () -> service.submitBuild(new BuildRequest(null, tempDir.resolve("gone").toString(), null, null, null, null)));
            assertThrows(ValidationException.class,
                    () -> service.submitBuild(new BuildRequest(null, dir, "../main.tex", null, null, null)));
            assertThrows(ValidationException.class,
                    () -> service.submitBuild(new BuildRequest(null, dir, "/etc/main.tex", null, null, null)));
            assertThrows(ValidationException.class,
                    () -> service.submitBuild(new BuildRequest(null, dir, "main.md", null, null, null)));
            assertThrows(ValidationException.class,
                    () -> service.submitBuild(new BuildRequest("bad id!", dir, null, null, null, null)));
        }

        @Test
        void cancelOfQueuedBuildGoesThroughProjectHook() throws Exception {
            Path project = Files.createDirectories(tempDir.resolve("project"));
            service.submitBuild(new BuildRequest("build-2", project.toString(), null, null, "p1", null));

            CancelResult result = service.cancelBuild("build-2");

            assertTrue(result.wasQueued());
            var change = ArgumentCaptor.forClass(JobStatusChange.class);
            verify(projectHook).onStatusChange(change.capture());
            assertEquals(JobStatus.CANCELED, change.getValue().status());
            assertEquals("build-2", change.getValue().jobId());
        }

        @Test
        void cancelOfRunningBuildLeavesItToTheWorker() throws Exception {
            Path project = Files.createDirectories(tempDir.resolve("project"));
            service.submitBuild(new BuildRequest("build-3", project.toString(), null, null, "p1", null));
            queue.claimNext("w1", Duration.ofMinutes(5));

            CancelResult result = service.cancelBuild("build-3");

            assertTrue(result.wasRunning());
            verifyNoInteractions(projectHook);
        }
    }
}
