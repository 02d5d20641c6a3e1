package com.waveforge.dispatch.cli;

import com.waveforge.backend.BackendException;
import com.waveforge.registry.ProcessRecord;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import com.waveforge.watchdog.Inspection;
import com.waveforge.watchdog.Watchdog;
import com.waveforge.watchdog.WatchdogFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: waveforge check &lt;task-id&gt;
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Show a registered task and probe it")
@Component
public class CheckCommand extends RegistryCommand {

    @Parameters(index = "0", description = "Registry task id, e.g. waveforge:T001")
    private String taskId;

    private final WatchdogFactory watchdogFactory;

    public CheckCommand(RegistryLocator locator, WatchdogFactory watchdogFactory) {
        super(locator);
        this.watchdogFactory = watchdogFactory;
    }

    @Override
    protected int run(ProcessRegistry registry) {
        Optional<ProcessRecord> record = registry.find(taskId);
        if (record.isEmpty()) {
            ConsoleOutput.error("Task " + taskId + " not found");
            return ExitCodes.HALTED;
        }
        ConsoleOutput.record(record.get());
        try (Watchdog watchdog = watchdogFactory.create(registry)) {
            Inspection inspection = watchdog.inspect(record.get());
            if (inspection.liveness().isAlive()) {
                ConsoleOutput.success("Worker alive");
            } else {
                ConsoleOutput.warn("Worker " + inspection.liveness().name().toLowerCase().replace('_', ' '));
            }
            if (inspection.usage() != null) {
                ConsoleOutput.usage(inspection.usage());
            } else if (inspection.sampleFailed()) {
                ConsoleOutput.warn("Could not sample: " + inspection.sampleError());
            }
        } catch (BackendException e) {
            ConsoleOutput.warn("Could not probe worker: " + e.getMessage());
        }
        return ExitCodes.OK;
    }
}
