package com.waveforge.backend;

import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.Fingerprint;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Native process operations used by the dispatcher and the watchdog.
 */
public interface ProcessBackend {

    /**
     * Starts {@code command} as the leader of a new process group, with stdout and stderr appended to {@code logFile}.
     *
     * @return the native execution mode, with the fingerprint captured at spawn
     */
    ExecutionMode.Native launch(List<String> command, Path workDir, Path logFile);

    /**
     * Looks up the live fingerprint of {@code pid}.
     *
     * @return empty when no process with that pid exists
     */
    Optional<Fingerprint> fingerprint(int pid);

    /**
     * @return the process group of a live process
     * @throws BackendException if the process does not exist
     */
    int processGroupOf(int pid);

    /**
     * @throws BackendException if the process cannot be sampled
     */
    ResourceUsage sample(int pid);

    /**
     * Terminates every process in the group: SIGTERM, then SIGKILL after {@code grace} if any member survives.
     */
    void killGroup(int pgid, Duration grace);
}
