package com.waveforge.core.model;

import java.util.List;

/**
 * An ordered batch of tasks determined safe to execute concurrently.
 *
 * @param id         monotonic wave number, starting at 1
 * @param strategy   PARALLEL if more than one task, SEQUENTIAL otherwise
 * @param tasks      member tasks in document order
 * @param rationale  human-readable reason for the grouping
 * @param checkpoint checkpoint policy applied after the wave
 */
public record Wave(
    int id,
    WaveStrategy strategy,
    List<Task> tasks,
    String rationale,
    CheckpointPolicy checkpoint
) {

    public Wave {
        tasks = List.copyOf(tasks);
    }

    public List<String> taskIds() {
        return tasks.stream().map(Task::id).toList();
    }

    public int size() {
        return tasks.size();
    }
}
