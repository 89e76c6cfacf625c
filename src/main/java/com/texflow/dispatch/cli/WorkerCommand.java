package com.texflow.dispatch.cli;

import com.texflow.core.events.EventBus;
import com.texflow.core.health.HeartbeatPublisher;
import com.texflow.core.worker.CompileWorker;
import com.texflow.core.worker.WorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.CountDownLatch;

/**
 * CLI command: texflow worker
 * <p>
 * Runs a dedicated compile worker: claims jobs from the shared queue and
 * publishes a heartbeat so web processes in dedicated mode accept
 * submissions. Blocks until the JVM is asked to shut down.
 */
@Command(name = "worker", mixinStandardHelpOptions = true,
        description = "Run a dedicated compile worker")
@Component
public class WorkerCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerCommand.class);

    @Option(names = {"--quiet", "-q"}, description = "Do not print job transitions to the console")
    private boolean quiet;

    private final CompileWorker worker;
    private final HeartbeatPublisher heartbeat;
    private final EventBus eventBus;
    private final WorkerProperties properties;

    public WorkerCommand(CompileWorker worker, HeartbeatPublisher heartbeat,
                         EventBus eventBus, WorkerProperties properties) {
        this.worker = worker;
        this.heartbeat = heartbeat;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (!properties.isDedicated()) {
            ConsoleOutput.warn("texflow.worker.mode is 'embedded'; web processes will not wait for this worker's heartbeat");
        }

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribeAll(ConsoleOutput::statusEvent);
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown, "worker-shutdown"));

        heartbeat.start();
        worker.start();
        ConsoleOutput.info("Worker " + properties.getInstanceId() + " running. Press Ctrl+C to stop.");

        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.info("Worker {} shutting down", properties.getInstanceId());
            worker.stop();
            heartbeat.stop();
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
