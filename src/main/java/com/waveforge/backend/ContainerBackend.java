package com.waveforge.backend;

import com.waveforge.registry.ExecutionMode;

/**
 * Container operations used by the dispatcher and the watchdog.
 * Implementations: {@link DockerContainerBackend}.
 */
public interface ContainerBackend {

    /**
     * Creates and starts a container.
     */
    ExecutionMode.Container run(ContainerSpec spec);

    /**
     * @return true when the container exists and is running; false when it is gone or stopped
     */
    boolean isRunning(String containerId);

    ResourceUsage sample(String containerId);

    /**
     * Kills and removes the container, taking every process inside it down.
     */
    void kill(String containerId);
}
