package com.waveforge.dispatch.cli;

import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import com.waveforge.watchdog.Rehydrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: waveforge rehydrate
 * <p>
 * Prints what the registry says is in flight, without probing any process.
 */
@Command(name = "rehydrate", mixinStandardHelpOptions = true,
        description = "Rebuild the picture of in-flight work from the registry")
@Component
public class RehydrateCommand extends RegistryCommand {

    public RehydrateCommand(RegistryLocator locator) {
        super(locator);
    }

    @Override
    protected int run(ProcessRegistry registry) {
        var report = new Rehydrator(registry.store(), locator.clock()).rehydrate();
        System.out.print(report.render());
        return ExitCodes.OK;
    }
}
