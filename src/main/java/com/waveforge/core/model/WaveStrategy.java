package com.waveforge.core.model;

/**
 * Descriptive execution strategy of a wave.
 * <p>
 * PARALLEL: more than one task; the tasks share no file lock and may run as independent workers.
 * SEQUENTIAL: exactly one task.
 * <p>
 * Actual concurrency belongs to whatever dispatches the agents.
 */
public enum WaveStrategy {
    SEQUENTIAL,
    PARALLEL;

    public static WaveStrategy forSize(int taskCount) {
        return taskCount > 1 ? PARALLEL : SEQUENTIAL;
    }
}
