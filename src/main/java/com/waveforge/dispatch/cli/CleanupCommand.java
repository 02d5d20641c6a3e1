package com.waveforge.dispatch.cli;

import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;

/**
 * CLI command: waveforge cleanup [--days N]
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true,
        description = "Remove COMPLETED and FAILED records older than the given age")
@Component
public class CleanupCommand extends RegistryCommand {

    @Option(names = "--days", description = "Age in days (default: ${DEFAULT-VALUE})", defaultValue = "7")
    private int days;

    public CleanupCommand(RegistryLocator locator) {
        super(locator);
    }

    @Override
    protected int run(ProcessRegistry registry) {
        if (days < 0) {
            ConsoleOutput.error("--days must not be negative");
            return ExitCodes.USAGE;
        }
        ConsoleOutput.info("Cleaning up tasks finished more than " + days + " day(s) ago...");
        int removed = registry.cleanup(Duration.ofDays(days));
        ConsoleOutput.success("Removed " + removed + " old task(s)");
        return ExitCodes.OK;
    }
}
