package com.texflow.sandbox;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything the container runtime needs to create one compile container.
 *
 * @param name             container name, unique per job
 * @param image            compiler image reference
 * @param command          entrypoint arguments
 * @param hostWorkDir      host directory mounted read-write into the container
 * @param containerWorkDir mount point and working directory inside the container
 * @param memoryBytes      hard memory ceiling, swap included
 * @param nanoCpus         CPU share in billionths of a CPU
 * @param pidsLimit        maximum number of processes
 * @param labels           metadata attached to the container
 */
public record ContainerSpec(
        String name,
        String image,
        List<String> command,
        Path hostWorkDir,
        String containerWorkDir,
        long memoryBytes,
        long nanoCpus,
        long pidsLimit,
        Map<String, String> labels
) {

    public ContainerSpec {
        command = List.copyOf(command);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
