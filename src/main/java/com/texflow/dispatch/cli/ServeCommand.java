package com.texflow.dispatch.cli;

import com.texflow.core.worker.CompileWorker;
import com.texflow.core.worker.WorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: texflow serve
 * <p>
 * Starts the HTTP API. The web server is enabled by
 * {@link com.texflow.TexflowApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so Tomcat keeps the JVM alive.
 * <p>
 * In embedded mode the compile worker is started in-process once the web
 * server is ready. In dedicated mode compiles are left to {@code texflow worker}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the TexFlow HTTP server")
@Component
public class ServeCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @Value("${server.port:8080}")
    private int port;

    private final WorkerProperties workerProperties;
    private final ObjectProvider<CompileWorker> compileWorker;

    public ServeCommand(WorkerProperties workerProperties, ObjectProvider<CompileWorker> compileWorker) {
        this.workerProperties = workerProperties;
        this.compileWorker = compileWorker;
    }

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port, workerProperties.isDedicated());
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        boolean dedicated = workerProperties.isDedicated();
        if (!dedicated) {
            log.info("Embedded worker mode: starting in-process compile worker");
            compileWorker.getObject().start();
        }
        printBanner(event.getWebServer().getPort(), dedicated);
    }

    private static void printBanner(int port, boolean dedicated) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("TexFlow server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println("  Worker:  " + (dedicated ? "dedicated (run 'texflow worker')" : "embedded"));
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
