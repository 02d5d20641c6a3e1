package com.waveforge.dispatch.cli;

import com.waveforge.backend.BackendException;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.ProcessRecord;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RecordStatus;
import com.waveforge.registry.RegistryLocator;
import com.waveforge.watchdog.Inspection;
import com.waveforge.watchdog.Watchdog;
import com.waveforge.watchdog.WatchdogFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: waveforge report
 * <p>
 * Resource usage of every running worker.
 */
@Command(name = "report", mixinStandardHelpOptions = true, description = "Show resource usage of running workers")
@Component
public class ReportCommand extends RegistryCommand {

    private final WatchdogFactory watchdogFactory;

    public ReportCommand(RegistryLocator locator, WatchdogFactory watchdogFactory) {
        super(locator);
        this.watchdogFactory = watchdogFactory;
    }

    @Override
    protected int run(ProcessRegistry registry) {
        System.out.println("Resource Usage Report");
        System.out.println("=====================");
        List<ProcessRecord> running = registry.snapshot().withStatus(RecordStatus.RUNNING);
        if (running.isEmpty()) {
            ConsoleOutput.info("No tasks currently running");
            return ExitCodes.OK;
        }
        try (Watchdog watchdog = watchdogFactory.create(registry)) {
            for (ProcessRecord record : running) {
                System.out.println();
                System.out.println("Task " + record.taskId());
                if (record.mode() instanceof ExecutionMode.Container container) {
                    System.out.println("   Container: " + container.shortId());
                    System.out.println("   Limits:    " + container.limits().memory() + " memory, "
                            + container.limits().cpu() + " CPU");
                }
                try {
                    Inspection inspection = watchdog.inspect(record);
                    if (inspection.usage() != null) {
                        ConsoleOutput.usage(inspection.usage());
                    } else if (inspection.sampleFailed()) {
                        ConsoleOutput.warn("Could not sample: " + inspection.sampleError());
                    } else {
                        ConsoleOutput.warn("Worker not found");
                    }
                } catch (BackendException e) {
                    ConsoleOutput.warn("Could not probe worker: " + e.getMessage());
                }
            }
        }
        return ExitCodes.OK;
    }
}
