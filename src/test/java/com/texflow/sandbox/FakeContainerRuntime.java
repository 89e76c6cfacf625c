package com.texflow.sandbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link ContainerRuntime} that simulates a latexmk run: after
 * {@code runMs} the container exits with {@code exitCode}, optionally
 * leaving a PDF in the mounted work directory.
 */
public class FakeContainerRuntime implements ContainerRuntime {

    public volatile long runMs = 10;
    public volatile int exitCode = 0;
    public volatile String output = "This is pdfTeX\nOutput written on main.pdf (1 page).\n";
    public volatile byte[] pdfBytes = "%PDF-1.5 fake".getBytes();
    public volatile boolean reachable = true;
    public volatile boolean imagePresent = true;
    public volatile RuntimeException failOnCreate;

    public final List<ContainerSpec> created = new CopyOnWriteArrayList<>();
    public final List<String> started = new CopyOnWriteArrayList<>();
    public final List<String> killed = new CopyOnWriteArrayList<>();
    public final List<String> removed = new CopyOnWriteArrayList<>();

    private final Map<String, ContainerSpec> specs = new ConcurrentHashMap<>();
    private final Map<String, Long> startTimes = new ConcurrentHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();

    @Override
    public String createContainer(ContainerSpec spec) {
        if (failOnCreate != null) {
            throw failOnCreate;
        }
        String id = "container-" + ids.incrementAndGet();
        specs.put(id, spec);
        created.add(spec);
        return id;
    }

    @Override
    public void startContainer(String containerId) {
        started.add(containerId);
        startTimes.put(containerId, System.currentTimeMillis());
        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
    }

    @Override
    public Integer awaitExit(String containerId, long timeoutMs) throws InterruptedException {
        if (killed.contains(containerId)) {
            return 137;
        }
        long elapsed = System.currentTimeMillis() - startTimes.get(containerId);
        long left = runMs - elapsed;
        if (left > timeoutMs) {
            Thread.sleep(timeoutMs);
            return null;
        }
        if (left > 0) {
            Thread.sleep(left);
        }
        finish(containerId);
        return exitCode;
    }

    @Override
    public String captureOutput(String containerId) {
        return output;
    }

    @Override
    public void kill(String containerId) {
        if (!killed.contains(containerId)) {
            killed.add(containerId);
            running.decrementAndGet();
        }
    }

    @Override
    public void remove(String containerId) {
        removed.add(containerId);
    }

    @Override
    public boolean imageExists(String image) {
        return imagePresent;
    }

    @Override
    public boolean ping() {
        return reachable;
    }

    public int maxConcurrentRuns() {
        return maxRunning.get();
    }

    private synchronized void finish(String containerId) {
        if (startTimes.remove(containerId) == null) {
            return;
        }
        running.decrementAndGet();
        ContainerSpec spec = specs.get(containerId);
        if (pdfBytes != null && exitCode == 0) {
            String main = spec.command().get(spec.command().size() - 1);
            String pdfName = (main.endsWith(".tex") ? main.substring(0, main.length() - 4) : main) + ".pdf";
            try {
                Files.write(spec.hostWorkDir().resolve(pdfName), pdfBytes);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
