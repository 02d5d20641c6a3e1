package com.waveforge.core.engine;

import java.util.List;

/**
 * A worker could not be started for a task.
 */
public class DispatchException extends WaveHaltException {

    private final String taskId;

    public DispatchException(int waveId, String taskId, Throwable cause) {
        super(waveId, "Failed to dispatch " + taskId + " in wave " + waveId + ": " + cause.getMessage(), cause);
        this.taskId = taskId;
    }

    @Override
    public List<String> taskIds() {
        return List.of(taskId);
    }
}
