package com.waveforge.core.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.waveforge.core.model.CheckpointPolicy;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.model.Task;
import com.waveforge.core.model.Wave;
import com.waveforge.core.model.WaveStrategy;

import java.util.List;

/**
 * On-disk shape of {@code execution_plan.json}.
 */
record PlanDocument(@JsonProperty("execution_plan") Body executionPlan) {

    record Body(
        @JsonProperty("phase_id") String phaseId,
        @JsonProperty("waves") List<WaveEntry> waves
    ) {}

    record WaveEntry(
        @JsonProperty("wave_id") int waveId,
        @JsonProperty("strategy") WaveStrategy strategy,
        @JsonProperty("rationale") String rationale,
        @JsonProperty("tasks") List<TaskEntry> tasks,
        @JsonProperty("checkpoint_after") CheckpointEntry checkpointAfter
    ) {}

    record TaskEntry(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("agent_role") String agentRole,
        @JsonProperty("instruction") String instruction,
        @JsonProperty("file_locks") List<String> fileLocks,
        @JsonProperty("constitution_rules") List<String> constitutionRules,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("completed") boolean completed,
        @JsonProperty("completion_handshake") String completionHandshake
    ) {}

    record CheckpointEntry(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("verification_criteria") String verificationCriteria
    ) {}

    static PlanDocument from(ExecutionPlan plan) {
        return new PlanDocument(new Body(plan.phaseId(), plan.waves().stream()
                .map(w -> new WaveEntry(w.id(), w.strategy(), w.rationale(),
                        w.tasks().stream().map(PlanDocument::toEntry).toList(),
                        new CheckpointEntry(w.checkpoint().enabled(), w.checkpoint().verificationCriteria())))
                .toList()));
    }

    ExecutionPlan toPlan() {
        return new ExecutionPlan(executionPlan.phaseId(), executionPlan.waves().stream()
                .map(w -> new Wave(w.waveId(), w.strategy(),
                        (w.tasks() == null ? List.<TaskEntry>of() : w.tasks()).stream()
                                .map(t -> new Task(t.taskId(), t.instruction(), t.agentRole(), t.fileLocks(),
                                        t.dependencies(), t.constitutionRules(), t.completed()))
                                .toList(),
                        w.rationale(),
                        w.checkpointAfter() == null
                                ? CheckpointPolicy.forWave(w.waveId())
                                : new CheckpointPolicy(w.checkpointAfter().enabled(),
                                        w.checkpointAfter().verificationCriteria())))
                .toList());
    }

    private static TaskEntry toEntry(Task t) {
        return new TaskEntry(t.id(), t.role(), t.description(), t.fileLocks(), t.rules(), t.dependencies(),
                t.completed(), t.completionHandshake());
    }
}
