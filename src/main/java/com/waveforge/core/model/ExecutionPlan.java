package com.waveforge.core.model;

import java.util.List;
import java.util.Optional;

/**
 * The planning artifact handed to execution: an ordered list of waves for one phase.
 * Immutable; a replan produces a new plan.
 */
public record ExecutionPlan(String phaseId, List<Wave> waves) {

    public ExecutionPlan {
        waves = List.copyOf(waves);
    }

    public int taskCount() {
        return waves.stream().mapToInt(Wave::size).sum();
    }

    public Optional<Wave> wave(int waveId) {
        return waves.stream().filter(w -> w.id() == waveId).findFirst();
    }

    public List<Task> tasks() {
        return waves.stream().flatMap(w -> w.tasks().stream()).toList();
    }
}
