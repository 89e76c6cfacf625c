package com.texflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for TexFlow.
 * Routes to subcommands: serve, worker, health, compile.
 */
@Command(
        name = "texflow",
        mixinStandardHelpOptions = true,
        version = "TexFlow 0.1.0",
        description = "Sandboxed LaTeX compile service",
        subcommands = {
                ServeCommand.class,
                WorkerCommand.class,
                HealthCommand.class,
                CompileCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TexflowCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
