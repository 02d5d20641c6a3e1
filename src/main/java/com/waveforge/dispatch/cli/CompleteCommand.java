package com.waveforge.dispatch.cli;

import com.waveforge.registry.ProcessRecord;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: waveforge complete &lt;task-id&gt;
 */
@Command(name = "complete", mixinStandardHelpOptions = true, description = "Mark a running task COMPLETED")
@Component
public class CompleteCommand extends RegistryCommand {

    @Parameters(index = "0", description = "Registry task id")
    private String taskId;

    public CompleteCommand(RegistryLocator locator) {
        super(locator);
    }

    @Override
    protected int run(ProcessRegistry registry) {
        try {
            ProcessRecord record = registry.markCompleted(taskId);
            ConsoleOutput.success("Task " + taskId + " is " + record.status());
            return ExitCodes.OK;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.HALTED;
        }
    }
}
