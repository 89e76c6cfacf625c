package com.texflow.dispatch.cli;

import com.texflow.core.errors.ValidationException;
import com.texflow.core.logparser.LatexLogParser;
import com.texflow.core.logparser.LogSummary;
import com.texflow.core.model.Engine;
import com.texflow.core.model.ParsedLogEntry;
import com.texflow.core.submission.CompileSubmissionService;
import com.texflow.sandbox.CompileExecutionEngine;
import com.texflow.sandbox.ExecutionRequest;
import com.texflow.sandbox.ExecutionResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * CLI command: texflow compile &lt;file.tex&gt;
 * <p>
 * Compiles a local document synchronously in the sandbox container,
 * bypassing the queue. The containing directory is mounted as the
 * workspace, so auxiliary files land next to the source.
 */
@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Compile a local .tex file in the sandbox")
@Component
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the main .tex file")
    private Path file;

    @Option(names = {"--engine", "-e"}, defaultValue = "auto",
            description = "auto, pdflatex, xelatex, lualatex or latex")
    private String engine;

    @Option(names = {"--out", "-o"}, description = "Copy the produced PDF to this path")
    private Path out;

    @Option(names = {"--logs"}, description = "Print the full compiler transcript")
    private boolean printLogs;

    private final CompileExecutionEngine executionEngine;

    public CompileCommand(CompileExecutionEngine executionEngine) {
        this.executionEngine = executionEngine;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();

        Path source = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(source) || !source.getFileName().toString().endsWith(".tex")) {
            ConsoleOutput.error("Not a .tex file: " + file);
            return 2;
        }
        Engine requested;
        try {
            requested = CompileSubmissionService.parseEngine(engine);
        } catch (ValidationException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        if (!executionEngine.isRuntimeReachable()) {
            ConsoleOutput.error("Container runtime is not reachable");
            return 3;
        }
        if (!executionEngine.isImageAvailable()) {
            ConsoleOutput.error("Compiler image " + executionEngine.getImage() + " is not available");
            return 3;
        }

        var request = new ExecutionRequest("cli-" + UUID.randomUUID(), source.getParent(),
                source.getFileName().toString(), requested);
        ConsoleOutput.info("Compiling " + source.getFileName() + "...");
        ExecutionResult result = executionEngine.run(request,
                resolved -> ConsoleOutput.info("Engine: " + resolved.wireName()));

        if (result.isContainerFailure()) {
            ConsoleOutput.error("Container error: " + result.containerError());
            return 3;
        }

        List<ParsedLogEntry> entries = LatexLogParser.parse(result.logs());
        LogSummary summary = LatexLogParser.summarize(entries);
        if (printLogs) {
            System.out.println(result.logs());
        }
        entries.stream()
                .filter(e -> e.type() != ParsedLogEntry.Type.INFO)
                .forEach(ConsoleOutput::logEntry);

        System.out.println("──────────────────────────────────");
        if (result.timedOut()) {
            ConsoleOutput.error("Compilation timed out after " + ConsoleOutput.formatDuration(result.durationMs()));
            return 1;
        }
        if (result.exitCode() != 0 || summary.hasErrors() || !result.hasPdf()) {
            ConsoleOutput.error("Compilation failed (exit " + result.exitCode() + ", "
                    + summary.errors() + " error(s))");
            return 1;
        }

        Path pdf = result.pdfPath();
        if (out != null) {
            Files.copy(pdf, out, StandardCopyOption.REPLACE_EXISTING);
            pdf = out;
        }
        ConsoleOutput.success("PDF written to " + pdf + " in " + ConsoleOutput.formatDuration(result.durationMs())
                + " (" + summary.warnings() + " warning(s))");
        return 0;
    }
}
