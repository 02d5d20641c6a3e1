package com.waveforge.dispatch.cli;

import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: waveforge stats
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show registry statistics")
@Component
public class StatsCommand extends RegistryCommand {

    public StatsCommand(RegistryLocator locator) {
        super(locator);
    }

    @Override
    protected int run(ProcessRegistry registry) {
        System.out.println("Registry Statistics");
        System.out.println("===================");
        ConsoleOutput.stats(registry.stats());
        return ExitCodes.OK;
    }
}
