package com.waveforge.dispatch.cli;

import com.waveforge.config.WaveforgeProperties;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.parser.TaskListException;
import com.waveforge.core.plan.PlanningService;
import com.waveforge.core.scheduler.PlanningException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: waveforge plan
 * <p>
 * Parses the task list, partitions it into waves and writes the execution plan.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Plan waves from the task list")
@Component
public class PlanCommand implements Callable<Integer> {

    @Option(names = "--tasks-file", description = "Task list (default: waveforge.tasks.file)")
    private String tasksFile;

    @Option(names = "--phase-id", description = "Phase identifier (default: waveforge.plan.phase-id)")
    private String phaseId;

    @Option(names = "--plan-file", description = "Plan output (default: waveforge.plan.file)")
    private String planFile;

    private final PlanningService planningService;
    private final WaveforgeProperties properties;

    public PlanCommand(PlanningService planningService, WaveforgeProperties properties) {
        this.planningService = planningService;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path tasks = Path.of(tasksFile != null ? tasksFile : properties.getTasks().getFile());
        String phase = phaseId != null ? phaseId : properties.getPlan().getPhaseId();
        Path output = Path.of(planFile != null ? planFile : properties.getPlan().getFile());
        try {
            ExecutionPlan plan = planningService.plan(tasks, phase, output);
            ConsoleOutput.plan(plan);
            ConsoleOutput.success("Plan written to " + output);
            return ExitCodes.OK;
        } catch (PlanningException e) {
            ConsoleOutput.planningFailure(e);
            return ExitCodes.HALTED;
        } catch (TaskListException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.HALTED;
        }
    }
}
