package com.texflow.sandbox;

/**
 * Minimal capability surface of the container runtime used for compiles.
 * Implementations: {@link DockerContainerRuntime}.
 */
public interface ContainerRuntime {

    /**
     * Creates (but does not start) a network-less, resource-limited container.
     * @return the container ID
     */
    String createContainer(ContainerSpec spec);

    void startContainer(String containerId);

    /**
     * Waits up to {@code timeoutMs} for the container to exit.
     * @return the exit code, or {@code null} if it is still running
     */
    Integer awaitExit(String containerId, long timeoutMs) throws InterruptedException;

    /**
     * Captures combined stdout/stderr of a stopped container.
     */
    String captureOutput(String containerId);

    /**
     * Terminates a running container. A container that already exited is not an error.
     */
    void kill(String containerId);

    /**
     * Force-removes the container and its anonymous volumes.
     */
    void remove(String containerId);

    boolean imageExists(String image);

    boolean ping();
}
