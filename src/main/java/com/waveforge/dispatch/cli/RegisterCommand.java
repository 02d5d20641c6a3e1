package com.waveforge.dispatch.cli;

import com.waveforge.backend.BackendException;
import com.waveforge.backend.ProcessBackend;
import com.waveforge.config.WaveforgeProperties;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.Fingerprint;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import com.waveforge.registry.ResourceLimits;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * CLI command: waveforge register &lt;task-id&gt; (--pid N | --container ID)
 * <p>
 * Registers a worker started outside Waveforge. For a pid, the start time and process group
 * are read from the live process.
 */
@Command(name = "register", mixinStandardHelpOptions = true, description = "Register an externally started worker")
@Component
public class RegisterCommand extends RegistryCommand {

    @Parameters(index = "0", description = "Registry task id")
    private String taskId;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Target target;

    static class Target {
        @Option(names = "--pid", description = "Process id of a native worker")
        Integer pid;

        @Option(names = "--container", description = "Container id of a containerized worker")
        String containerId;
    }

    @Option(names = "--command", description = "Command the worker runs", defaultValue = "")
    private String command;

    @Option(names = "--rules", description = "Comma-separated policy rule names")
    private String rules;

    private final ProcessBackend processBackend;
    private final WaveforgeProperties properties;

    public RegisterCommand(RegistryLocator locator, ProcessBackend processBackend, WaveforgeProperties properties) {
        super(locator);
        this.processBackend = processBackend;
        this.properties = properties;
    }

    @Override
    protected int run(ProcessRegistry registry) {
        ExecutionMode mode;
        if (target.pid != null) {
            Optional<Fingerprint> fingerprint = processBackend.fingerprint(target.pid);
            if (fingerprint.isEmpty()) {
                ConsoleOutput.error("No process with pid " + target.pid);
                return ExitCodes.HALTED;
            }
            int pgid;
            try {
                pgid = processBackend.processGroupOf(target.pid);
            } catch (BackendException e) {
                ConsoleOutput.error(e.getMessage());
                return ExitCodes.HALTED;
            }
            mode = new ExecutionMode.Native(target.pid, pgid, fingerprint.get().startTime());
        } else {
            var dispatch = properties.getDispatch();
            mode = new ExecutionMode.Container(target.containerId, null,
                    new ResourceLimits(dispatch.getMemory(), dispatch.getCpu()));
        }

        List<String> ruleList = rules == null || rules.isBlank()
                ? List.of()
                : Arrays.stream(rules.split(",")).map(String::strip).filter(r -> !r.isEmpty()).toList();
        registry.register(taskId, mode, command, ruleList);
        ConsoleOutput.success("Registered " + taskId + " as " + mode.label()
                + (ruleList.isEmpty() ? " (no rules)" : " with " + ruleList.size() + " rule(s)"));
        return ExitCodes.OK;
    }
}
