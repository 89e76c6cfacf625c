package com.texflow.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Docker-backed {@link ContainerRuntime}.
 *
 * <p>Each compile container is configured with:
 * <ul>
 *   <li>A bind mount mapping the staged source directory to the container work dir</li>
 *   <li>Networking disabled</li>
 *   <li>Memory (swap included), CPU and PID ceilings</li>
 *   <li>All capabilities dropped and {@code no-new-privileges}</li>
 * </ul>
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    private final DockerClient dockerClient;

    public DockerContainerRuntime(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public String createContainer(ContainerSpec spec) {
        // Clean up any stale container with the same name from a crashed attempt
        try {
            dockerClient.removeContainerCmd(spec.name()).withForce(true).exec();
            log.debug("Removed stale container {}", spec.name());
        } catch (NotFoundException e) {
            log.trace("No stale container named {}", spec.name());
        }

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(spec.hostWorkDir().toString(),
                        new Volume(spec.containerWorkDir()), AccessMode.rw))
                .withMemory(spec.memoryBytes())
                .withMemorySwap(spec.memoryBytes())
                .withNanoCPUs(spec.nanoCpus())
                .withPidsLimit(spec.pidsLimit())
                .withNetworkMode("none")
                .withCapDrop(Capability.ALL)
                .withSecurityOpts(List.of("no-new-privileges"));

        var response = dockerClient.createContainerCmd(spec.image())
                .withName(spec.name())
                .withHostConfig(hostConfig)
                .withNetworkDisabled(true)
                .withLabels(spec.labels())
                .withCmd(spec.command())
                .withWorkingDir(spec.containerWorkDir())
                .exec();

        log.info("Created container {} ({}) from image {}", spec.name(), response.getId(), spec.image());
        return response.getId();
    }

    @Override
    public void startContainer(String containerId) {
        dockerClient.startContainerCmd(containerId).exec();
    }

    @Override
    public Integer awaitExit(String containerId, long timeoutMs) throws InterruptedException {
        var callback = dockerClient.waitContainerCmd(containerId)
                .exec(new WaitContainerResultCallback());
        try {
            if (!callback.awaitCompletion(timeoutMs, TimeUnit.MILLISECONDS)) {
                return null;
            }
            return callback.awaitStatusCode();
        } finally {
            closeQuietly(callback, containerId);
        }
    }

    @Override
    public String captureOutput(String containerId) {
        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from container {}", containerId);
        }
        return sb.toString().replace("\u0000", "");
    }

    @Override
    public void kill(String containerId) {
        try {
            dockerClient.killContainerCmd(containerId).exec();
            log.info("Killed container {}", containerId);
        } catch (NotFoundException | ConflictException e) {
            log.debug("Container {} was not running: {}", containerId, e.getMessage());
        }
    }

    @Override
    public void remove(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId)
                    .withForce(true)
                    .withRemoveVolumes(true)
                    .exec();
            log.debug("Removed container {}", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (Exception e) {
            log.warn("Failed to remove container {}", containerId, e);
        }
    }

    @Override
    public boolean imageExists(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    @Override
    public boolean ping() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (Exception e) {
            log.warn("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static void closeQuietly(WaitContainerResultCallback callback, String containerId) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Failed to close wait callback for container {}: {}", containerId, e.getMessage());
        }
    }
}
