package com.waveforge.watchdog;

import com.waveforge.backend.BackendException;
import com.waveforge.backend.ContainerBackend;
import com.waveforge.backend.ProcessBackend;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.Fingerprint;

import java.util.Optional;

/**
 * Answers whether the worker behind a registry record still exists.
 */
public class LivenessProbe {

    public enum Liveness {
        ALIVE,
        DEAD,
        /** The pid is live but belongs to a different process than the one registered. */
        PID_REUSED;

        public boolean isAlive() {
            return this == ALIVE;
        }
    }

    private final ProcessBackend processes;
    private final ContainerBackend containers;

    /**
     * @param containers may be null when containers are not in use; probing a container record then fails
     */
    public LivenessProbe(ProcessBackend processes, ContainerBackend containers) {
        this.processes = processes;
        this.containers = containers;
    }

    /**
     * @throws BackendException if the backend cannot answer
     */
    public Liveness probe(ExecutionMode mode) {
        if (mode instanceof ExecutionMode.Native nativeMode) {
            return probeNative(nativeMode);
        }
        if (mode instanceof ExecutionMode.Container container) {
            return probeContainer(container);
        }
        throw new IllegalStateException("Unknown execution mode: " + mode);
    }

    private Liveness probeNative(ExecutionMode.Native mode) {
        Optional<Fingerprint> live = processes.fingerprint(mode.pid());
        if (live.isEmpty()) {
            return Liveness.DEAD;
        }
        return mode.fingerprint().matches(live.get()) ? Liveness.ALIVE : Liveness.PID_REUSED;
    }

    private Liveness probeContainer(ExecutionMode.Container mode) {
        if (containers == null) {
            throw new BackendException("No container backend configured to probe " + mode.shortId());
        }
        return containers.isRunning(mode.id()) ? Liveness.ALIVE : Liveness.DEAD;
    }
}
