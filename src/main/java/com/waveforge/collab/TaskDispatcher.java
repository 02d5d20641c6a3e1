package com.waveforge.collab;

import com.waveforge.core.model.Task;
import com.waveforge.registry.ExecutionMode;

import java.util.Optional;

/**
 * Hands a task to a worker.
 */
public interface TaskDispatcher {

    /**
     * @return how the spawned worker runs, or empty when nothing was spawned and the task is
     *         expected to be completed out of band
     * @throws com.waveforge.backend.BackendException if the worker cannot be started
     */
    Optional<ExecutionMode> dispatch(Task task);
}
