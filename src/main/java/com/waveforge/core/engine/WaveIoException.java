package com.waveforge.core.engine;

import java.util.List;

/**
 * The task list or the process registry could not be read or written while a wave was in flight.
 * Carries the ids of every task in the wave, since any of them may be left unverified.
 */
public class WaveIoException extends WaveHaltException {

    private final List<String> taskIds;

    public WaveIoException(int waveId, List<String> taskIds, Throwable cause) {
        super(waveId, "I/O failure in wave " + waveId + ": " + cause.getMessage(), cause);
        this.taskIds = List.copyOf(taskIds);
    }

    @Override
    public List<String> taskIds() {
        return taskIds;
    }
}
