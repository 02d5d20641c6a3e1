package com.waveforge.backend;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Statistics;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.InvocationBuilder;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.ResourceLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Locale;

/**
 * {@link ContainerBackend} on docker-java.
 *
 * <p>Each worker container gets:
 * <ul>
 *   <li>the task's working directory bind-mounted at {@code /workspace}</li>
 *   <li>memory and CPU limits from its {@link ResourceLimits}</li>
 *   <li>the name {@code waveforge-<task id>}, so a stale container from an earlier attempt is replaced</li>
 * </ul>
 */
public class DockerContainerBackend implements ContainerBackend {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerBackend.class);

    private final DockerClient dockerClient;

    public DockerContainerBackend(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public ExecutionMode.Container run(ContainerSpec spec) {
        String containerName = containerName(spec.taskId());
        ResourceLimits limits = spec.limits() != null ? spec.limits() : ResourceLimits.defaults();

        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (NotFoundException e) {
            log.trace("No stale container {}", containerName);
        }

        var env = new ArrayList<String>();
        spec.env().forEach((k, v) -> env.add(k + "=" + v));

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(spec.workDir().toAbsolutePath().toString(), new Volume("/workspace"), AccessMode.rw))
                .withMemory(parseMemory(limits.memory()))
                .withNanoCPUs(parseNanoCpus(limits.cpu()));

        try {
            var create = dockerClient.createContainerCmd(spec.image())
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withEnv(env)
                    .withWorkingDir("/workspace");
            if (!spec.command().isEmpty()) {
                create.withCmd(spec.command());
            }
            var response = create.exec();
            String containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Container {} started for task {} (image: {}, memory: {}, cpu: {})",
                    containerName, spec.taskId(), spec.image(), limits.memory(), limits.cpu());
            return new ExecutionMode.Container(containerId, containerName, limits);
        } catch (RuntimeException e) {
            throw new BackendException("Failed to start container " + containerName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isRunning(String containerId) {
        try {
            var state = dockerClient.inspectContainerCmd(containerId).exec().getState();
            return state != null && Boolean.TRUE.equals(state.getRunning());
        } catch (NotFoundException e) {
            return false;
        }
    }

    @Override
    public ResourceUsage sample(String containerId) {
        Statistics stats;
        try {
            stats = dockerClient.statsCmd(containerId)
                    .withNoStream(true)
                    .exec(new InvocationBuilder.AsyncResultCallback<>())
                    .awaitResult();
        } catch (RuntimeException e) {
            throw new BackendException("Cannot sample container " + containerId + ": " + e.getMessage(), e);
        }
        if (stats == null) {
            throw new BackendException("No statistics for container " + containerId);
        }
        return toUsage(stats);
    }

    @Override
    public void kill(String containerId) {
        try {
            dockerClient.killContainerCmd(containerId).exec();
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
            return;
        } catch (ConflictException e) {
            log.debug("Container {} is not running: {}", containerId, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Container {} killed and removed", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} removed concurrently", containerId);
        }
    }

    static String containerName(String taskId) {
        return "waveforge-" + taskId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_.-]", "-");
    }

    /**
     * Parses docker memory notation ({@code 512m}, {@code 2g}, {@code 1024k}, plain bytes).
     */
    static long parseMemory(String memory) {
        String value = memory.strip().toLowerCase(Locale.ROOT);
        if (value.endsWith("b")) {
            value = value.substring(0, value.length() - 1);
        }
        long multiplier = 1;
        char unit = value.charAt(value.length() - 1);
        switch (unit) {
            case 'k' -> multiplier = 1024L;
            case 'm' -> multiplier = 1024L * 1024;
            case 'g' -> multiplier = 1024L * 1024 * 1024;
            default -> { }
        }
        if (multiplier > 1) {
            value = value.substring(0, value.length() - 1);
        }
        try {
            return Long.parseLong(value) * multiplier;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid memory limit: " + memory, e);
        }
    }

    static long parseNanoCpus(String cpu) {
        try {
            return Math.round(Double.parseDouble(cpu.strip()) * 1_000_000_000d);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid CPU limit: " + cpu, e);
        }
    }

    private static ResourceUsage toUsage(Statistics stats) {
        double cpuPercent = 0.0;
        var cpu = stats.getCpuStats();
        var preCpu = stats.getPreCpuStats();
        if (cpu != null && preCpu != null && cpu.getCpuUsage() != null && preCpu.getCpuUsage() != null
                && cpu.getSystemCpuUsage() != null && preCpu.getSystemCpuUsage() != null) {
            long cpuDelta = cpu.getCpuUsage().getTotalUsage() - preCpu.getCpuUsage().getTotalUsage();
            long systemDelta = cpu.getSystemCpuUsage() - preCpu.getSystemCpuUsage();
            long onlineCpus = cpu.getOnlineCpus() != null ? cpu.getOnlineCpus() : 1L;
            if (cpuDelta > 0 && systemDelta > 0) {
                cpuPercent = (double) cpuDelta / systemDelta * onlineCpus * 100.0;
            }
        }
        long memoryBytes = 0;
        if (stats.getMemoryStats() != null && stats.getMemoryStats().getUsage() != null) {
            memoryBytes = stats.getMemoryStats().getUsage();
        }
        return new ResourceUsage(cpuPercent, memoryBytes / 1024);
    }
}
