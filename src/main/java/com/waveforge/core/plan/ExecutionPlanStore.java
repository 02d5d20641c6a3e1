package com.waveforge.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.model.Task;
import com.waveforge.core.model.Wave;
import com.waveforge.core.model.WaveStrategy;
import com.waveforge.core.persistence.AtomicFileWriter;
import com.waveforge.core.persistence.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes and re-loads the execution plan document, the contract between planning and execution.
 */
@Component
public class ExecutionPlanStore {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanStore.class);

    private final ObjectMapper mapper = JsonMappers.documentMapper();

    public void write(ExecutionPlan plan, Path planFile) {
        try {
            byte[] json = mapper.writeValueAsBytes(PlanDocument.from(plan));
            AtomicFileWriter.write(planFile, json);
            log.info("Execution plan written to {} ({} waves, {} tasks)",
                    planFile, plan.waves().size(), plan.taskCount());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write execution plan " + planFile, e);
        }
    }

    /**
     * Loads and validates a plan document.
     *
     * @throws PlanFormatException if the file is missing or malformed, or if its waves could not have come
     *                             from the planner: a task in two waves, two tasks of one wave sharing a
     *                             file lock, or a dependency that is not in an earlier wave
     */
    public ExecutionPlan load(Path planFile) {
        if (!Files.exists(planFile)) {
            throw new PlanFormatException(planFile, "not found; run 'waveforge plan' first");
        }
        PlanDocument document;
        try {
            document = mapper.readValue(Files.readAllBytes(planFile), PlanDocument.class);
        } catch (JsonProcessingException e) {
            throw new PlanFormatException(planFile, "invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PlanFormatException(planFile, "unreadable: " + e.getMessage(), e);
        }
        if (document == null || document.executionPlan() == null || document.executionPlan().waves() == null) {
            throw new PlanFormatException(planFile, "missing 'execution_plan.waves'");
        }
        var plan = document.toPlan();
        validate(plan, planFile);
        log.info("Loaded plan for phase {} from {}: {} waves", plan.phaseId(), planFile, plan.waves().size());
        return plan;
    }

    static void validate(ExecutionPlan plan, Path planFile) {
        Set<String> planned = plan.waves().stream()
                .flatMap(w -> w.tasks().stream())
                .map(Task::id)
                .collect(Collectors.toSet());
        var seen = new HashSet<String>();
        int expectedWaveId = 1;
        for (Wave wave : plan.waves()) {
            if (wave.id() != expectedWaveId) {
                throw new PlanFormatException(planFile,
                        "wave ids must be consecutive from 1; expected " + expectedWaveId + " but found " + wave.id());
            }
            if (wave.tasks().isEmpty()) {
                throw new PlanFormatException(planFile, "wave " + wave.id() + " has no tasks");
            }
            if (wave.strategy() != WaveStrategy.forSize(wave.size())) {
                throw new PlanFormatException(planFile, "wave " + wave.id() + " strategy " + wave.strategy()
                        + " does not match its " + wave.size() + " task(s)");
            }
            var earlier = Set.copyOf(seen);
            var lockOwners = new HashMap<String, String>();
            for (Task task : wave.tasks()) {
                if (task.id() == null || task.id().isBlank()) {
                    throw new PlanFormatException(planFile, "wave " + wave.id() + " contains a task without an id");
                }
                if (!seen.add(task.id())) {
                    throw new PlanFormatException(planFile, "task " + task.id() + " appears in more than one wave");
                }
                for (String lock : task.fileLocks()) {
                    String owner = lockOwners.putIfAbsent(lock, task.id());
                    if (owner != null) {
                        throw new PlanFormatException(planFile, "wave " + wave.id() + ": " + owner + " and "
                                + task.id() + " both lock " + lock);
                    }
                }
                for (String dependency : task.dependencies()) {
                    if (!planned.contains(dependency)) {
                        throw new PlanFormatException(planFile, "task " + task.id()
                                + " depends on unknown task " + dependency);
                    }
                    if (!earlier.contains(dependency)) {
                        throw new PlanFormatException(planFile, "task " + task.id() + " in wave " + wave.id()
                                + " depends on " + dependency + ", which is not in an earlier wave");
                    }
                }
            }
            expectedWaveId++;
        }
    }
}
