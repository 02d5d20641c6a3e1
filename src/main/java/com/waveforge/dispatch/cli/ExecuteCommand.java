package com.waveforge.dispatch.cli;

import com.waveforge.config.WaveforgeProperties;
import com.waveforge.core.engine.WaveExecutor;
import com.waveforge.core.engine.WaveHaltException;
import com.waveforge.core.events.EventBus;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.plan.ExecutionPlanStore;
import com.waveforge.core.plan.PlanFormatException;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: waveforge execute
 * <p>
 * Runs a previously written plan wave by wave, halting on the first failed wave.
 * Progress events of the phase are printed as they happen.
 */
@Command(name = "execute", mixinStandardHelpOptions = true, description = "Execute a saved plan")
@Component
public class ExecuteCommand implements Callable<Integer> {

    @Option(names = "--plan-file", description = "Plan to execute (default: waveforge.plan.file)")
    private String planFile;

    private final ExecutionPlanStore planStore;
    private final ObjectProvider<WaveExecutor> executor;
    private final WaveforgeProperties properties;
    private final EventBus eventBus;
    private final MeterRegistry meterRegistry;

    public ExecuteCommand(ExecutionPlanStore planStore, ObjectProvider<WaveExecutor> executor,
                          WaveforgeProperties properties, EventBus eventBus, MeterRegistry meterRegistry) {
        this.planStore = planStore;
        this.executor = executor;
        this.properties = properties;
        this.eventBus = eventBus;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Path input = Path.of(planFile != null ? planFile : properties.getPlan().getFile());
        ExecutionPlan plan;
        try {
            plan = planStore.load(input);
        } catch (PlanFormatException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.HALTED;
        }
        return execute(executor.getObject(), plan, eventBus, meterRegistry);
    }

    static int execute(WaveExecutor executor, ExecutionPlan plan, EventBus eventBus, MeterRegistry meterRegistry) {
        ConsoleOutput.plan(plan);
        try (var progress = eventBus.subscribe(plan.phaseId(), ConsoleOutput::event)) {
            ConsoleOutput.executionReport(executor.execute(plan));
            return ExitCodes.OK;
        } catch (WaveHaltException e) {
            ConsoleOutput.halt(e);
            return ExitCodes.HALTED;
        } finally {
            ConsoleOutput.metrics(meterRegistry);
        }
    }
}
