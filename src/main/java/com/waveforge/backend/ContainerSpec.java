package com.waveforge.backend;

import com.waveforge.registry.ResourceLimits;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to start a worker container.
 *
 * @param taskId   task the container works on; used for the container name
 * @param image    image to run
 * @param command  command passed to the container entrypoint
 * @param workDir  host directory mounted at {@code /workspace}
 * @param env      environment variables
 * @param limits   memory and CPU limits
 */
public record ContainerSpec(
    String taskId,
    String image,
    List<String> command,
    Path workDir,
    Map<String, String> env,
    ResourceLimits limits
) {}
