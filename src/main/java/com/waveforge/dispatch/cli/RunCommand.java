package com.waveforge.dispatch.cli;

import com.waveforge.config.WaveforgeProperties;
import com.waveforge.core.engine.WaveExecutor;
import com.waveforge.core.events.EventBus;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.parser.TaskListException;
import com.waveforge.core.plan.PlanningService;
import com.waveforge.core.scheduler.PlanningException;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: waveforge run
 * <p>
 * Plans from the configured task list, writes the plan, then executes it.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan, then execute")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = "--phase-id", description = "Phase identifier (default: waveforge.plan.phase-id)")
    private String phaseId;

    private final PlanningService planningService;
    private final ObjectProvider<WaveExecutor> executor;
    private final WaveforgeProperties properties;
    private final EventBus eventBus;
    private final MeterRegistry meterRegistry;

    public RunCommand(PlanningService planningService, ObjectProvider<WaveExecutor> executor,
                      WaveforgeProperties properties, EventBus eventBus, MeterRegistry meterRegistry) {
        this.planningService = planningService;
        this.executor = executor;
        this.properties = properties;
        this.eventBus = eventBus;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String phase = phaseId != null ? phaseId : properties.getPlan().getPhaseId();
        ExecutionPlan plan;
        try (var planned = eventBus.subscribe(phase, ConsoleOutput::event)) {
            plan = planningService.plan(Path.of(properties.getTasks().getFile()), phase,
                    Path.of(properties.getPlan().getFile()));
        } catch (PlanningException e) {
            ConsoleOutput.planningFailure(e);
            return ExitCodes.HALTED;
        } catch (TaskListException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.HALTED;
        }
        return ExecuteCommand.execute(executor.getObject(), plan, eventBus, meterRegistry);
    }
}
