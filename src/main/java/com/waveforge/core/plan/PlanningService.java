package com.waveforge.core.plan;

import com.waveforge.core.events.EventBus;
import com.waveforge.core.events.EventTypes;
import com.waveforge.core.events.WaveforgeEvent;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.model.Task;
import com.waveforge.core.parser.TaskParser;
import com.waveforge.core.scheduler.WavePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Task list in, persisted execution plan out.
 */
@Service
public class PlanningService {

    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    private final TaskParser parser;
    private final WavePlanner planner;
    private final ExecutionPlanStore planStore;
    private final EventBus eventBus;

    public PlanningService(TaskParser parser, WavePlanner planner, ExecutionPlanStore planStore, EventBus eventBus) {
        this.parser = parser;
        this.planner = planner;
        this.planStore = planStore;
        this.eventBus = eventBus;
    }

    /**
     * @throws com.waveforge.core.parser.TaskListException if the task list cannot be read
     * @throws com.waveforge.core.scheduler.PlanningException if no valid wave order exists; nothing is written
     */
    public ExecutionPlan plan(Path tasksFile, String phaseId, Path planFile) {
        List<Task> tasks = parser.parse(tasksFile);
        ExecutionPlan plan = planner.plan(tasks, phaseId);
        planStore.write(plan, planFile);
        log.info("Wrote plan for phase {} to {}", phaseId, planFile);
        eventBus.publish(WaveforgeEvent.of(EventTypes.PLAN_CREATED, phaseId, null, Map.of(
                "tasks", plan.taskCount(),
                "waves", plan.waves().size(),
                "planFile", planFile.toString())));
        return plan;
    }
}
