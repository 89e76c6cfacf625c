package com.texflow.dispatch.cli;

import com.texflow.core.events.EventBus;
import com.texflow.core.health.HealthCheckService;
import com.texflow.core.health.HealthStatus;
import com.texflow.core.health.HeartbeatPublisher;
import com.texflow.core.model.Engine;
import com.texflow.core.worker.CompileWorker;
import com.texflow.core.worker.WorkerProperties;
import com.texflow.sandbox.CompileExecutionEngine;
import com.texflow.sandbox.ExecutionRequest;
import com.texflow.sandbox.ExecutionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    @TempDir
    Path tempDir;

    private record CliResult(int exitCode, String output) {}

    private CommandLine.IFactory createFactory(CompileExecutionEngine engine, HealthCheckService health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == CompileCommand.class) {
                    return (K) new CompileCommand(engine);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == ServeCommand.class) {
                    ObjectProvider<CompileWorker> provider = mock(ObjectProvider.class);
                    return (K) new ServeCommand(new WorkerProperties(), provider);
                }
                if (cls == WorkerCommand.class) {
                    return (K) new WorkerCommand(mock(CompileWorker.class), mock(HeartbeatPublisher.class),
                            mock(EventBus.class), new WorkerProperties());
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(CompileExecutionEngine.class), mock(HealthCheckService.class), args);
    }

    private CliResult execute(CompileExecutionEngine engine, HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new TexflowCommand(), createFactory(engine, health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("serve", "worker", "health", "compile", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("Sandboxed LaTeX compile service"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TexFlow 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noArgsPrintsUsage() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TEXFLOW"));
            assertTrue(result.output().contains("Usage: texflow"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        void allUpExitsZero() {
            HealthCheckService health = mock(HealthCheckService.class);
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("queue", HealthStatus.Status.UP, "Broker reachable", Map.of())));

            CliResult result = execute(mock(CompileExecutionEngine.class), health, "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("queue: Broker reachable"));
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        void downComponentExitsOne() {
            HealthCheckService health = mock(HealthCheckService.class);
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("queue", HealthStatus.Status.UP, "Broker reachable", Map.of()),
                    new HealthStatus("docker", HealthStatus.Status.DOWN, "Container runtime not reachable", Map.of())));

            CliResult result = execute(mock(CompileExecutionEngine.class), health, "health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("docker: Container runtime not reachable"));
        }
    }

    @Nested
    @DisplayName("compile")
    class CompileTests {

        private CompileExecutionEngine reachableEngine() {
            CompileExecutionEngine engine = mock(CompileExecutionEngine.class);
            when(engine.isRuntimeReachable()).thenReturn(true);
            when(engine.isImageAvailable()).thenReturn(true);
            return engine;
        }

        @Test
        void successfulCompileCopiesPdf() throws Exception {
            Path tex = Files.writeString(tempDir.resolve("paper.tex"), "\\documentclass{article}");
            Path pdf = Files.write(tempDir.resolve("paper.pdf"), new byte[]{'%', 'P', 'D', 'F'});
            Path out = tempDir.resolve("copy.pdf");
            CompileExecutionEngine engine = reachableEngine();
            when(engine.run(any(ExecutionRequest.class), any())).thenReturn(new ExecutionResult(
                    "LaTeX Warning: Citation `knuth' undefined.", 0, true, false, false,
                    Engine.PDFLATEX, pdf, 1500));

            CliResult result = execute(engine, mock(HealthCheckService.class),
                    "compile", tex.toString(), "--engine", "pdflatex", "--out", out.toString());

            assertEquals(0, result.exitCode(), result.output());
            assertArrayEquals(Files.readAllBytes(pdf), Files.readAllBytes(out));
            assertTrue(result.output().contains("1 warning(s)"));
            verify(engine).run(argThat(r -> r.requestedEngine() == Engine.PDFLATEX
                    && r.mainFile().equals("paper.tex")
                    && r.workDir().equals(tempDir.toAbsolutePath().normalize())), any());
        }

        @Test
        void latexErrorsExitOne() throws Exception {
            Path tex = Files.writeString(tempDir.resolve("broken.tex"), "\\foo");
            CompileExecutionEngine engine = reachableEngine();
            when(engine.run(any(ExecutionRequest.class), any())).thenReturn(new ExecutionResult(
                    "! Undefined control sequence.\nl.1 \\foo", 12, true, false, false,
                    Engine.PDFLATEX, null, 900));

            CliResult result = execute(engine, mock(HealthCheckService.class), "compile", tex.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Undefined control sequence."));
            assertTrue(result.output().contains("exit 12, 1 error(s)"));
        }

        @Test
        void timeoutExitsOne() throws Exception {
            Path tex = Files.writeString(tempDir.resolve("slow.tex"), "\\loop");
            CompileExecutionEngine engine = reachableEngine();
            when(engine.run(any(ExecutionRequest.class), any())).thenReturn(new ExecutionResult(
                    "", -1, false, true, false, Engine.PDFLATEX, null, 120_000));

            CliResult result = execute(engine, mock(HealthCheckService.class), "compile", tex.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("timed out after 2m 0s"));
        }

        @Test
        void rejectsNonTexFileAndUnknownEngine() throws Exception {
            Path md = Files.writeString(tempDir.resolve("notes.md"), "# hi");
            Path tex = Files.writeString(tempDir.resolve("ok.tex"), "x");
            CompileExecutionEngine engine = reachableEngine();

            assertEquals(2, execute(engine, mock(HealthCheckService.class), "compile", md.toString()).exitCode());
            assertEquals(2, execute(engine, mock(HealthCheckService.class),
                    "compile", tex.toString(), "-e", "context").exitCode());
            verify(engine, never()).run(any(), any());
        }

        @Test
        void unreachableRuntimeExitsThree() throws Exception {
            Path tex = Files.writeString(tempDir.resolve("ok.tex"), "x");

            CliResult result = execute(mock(CompileExecutionEngine.class), mock(HealthCheckService.class),
                    "compile", tex.toString());

            assertEquals(3, result.exitCode());
            assertTrue(result.output().contains("Container runtime is not reachable"));
        }

        @Test
        void missingImageExitsThree() throws Exception {
            Path tex = Files.writeString(tempDir.resolve("ok.tex"), "x");
            CompileExecutionEngine engine = reachableEngine();
            when(engine.isImageAvailable()).thenReturn(false);
            when(engine.getImage()).thenReturn("texflow-compiler:latest");

            CliResult result = execute(engine, mock(HealthCheckService.class), "compile", tex.toString());

            assertEquals(3, result.exitCode());
            assertTrue(result.output().contains("Compiler image texflow-compiler:latest is not available"));
            verify(engine, never()).run(any(), any());
        }

        @Test
        void containerFailureExitsThree() throws Exception {
            Path tex = Files.writeString(tempDir.resolve("ok.tex"), "x");
            CompileExecutionEngine engine = reachableEngine();
            when(engine.run(any(ExecutionRequest.class), any())).thenReturn(new ExecutionResult(
                    "[Docker] Container error: no such image", -1, false, false, false,
                    Engine.PDFLATEX, null, 40, "no such image"));

            CliResult result = execute(engine, mock(HealthCheckService.class), "compile", tex.toString());

            assertEquals(3, result.exitCode());
            assertTrue(result.output().contains("Container error: no such image"));
        }
    }

    @Test
    void formatDuration() {
        assertEquals("850ms", ConsoleOutput.formatDuration(850));
        assertEquals("12s", ConsoleOutput.formatDuration(12_400));
        assertEquals("2m 5s", ConsoleOutput.formatDuration(125_000));
    }
}
