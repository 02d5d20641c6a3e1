package com.waveforge.dispatch.cli;

import com.waveforge.backend.BackendException;
import com.waveforge.registry.ProcessRecord;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import com.waveforge.watchdog.Watchdog;
import com.waveforge.watchdog.WatchdogFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: waveforge kill &lt;task-id&gt;
 */
@Command(name = "kill", mixinStandardHelpOptions = true,
        description = "Kill a task's process group or container and mark it FAILED")
@Component
public class KillCommand extends RegistryCommand {

    @Parameters(index = "0", description = "Registry task id")
    private String taskId;

    private final WatchdogFactory watchdogFactory;

    public KillCommand(RegistryLocator locator, WatchdogFactory watchdogFactory) {
        super(locator);
        this.watchdogFactory = watchdogFactory;
    }

    @Override
    protected int run(ProcessRegistry registry) {
        try (Watchdog watchdog = watchdogFactory.create(registry)) {
            ProcessRecord killed = watchdog.kill(taskId);
            ConsoleOutput.success("Killed " + taskId + " (" + killed.mode().label() + "), status " + killed.status());
            return ExitCodes.OK;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.HALTED;
        } catch (BackendException e) {
            ConsoleOutput.error("Kill failed: " + e.getMessage());
            return ExitCodes.HALTED;
        }
    }
}
