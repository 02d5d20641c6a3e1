package com.waveforge.dispatch.cli;

import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryCorruptionException;
import com.waveforge.registry.RegistryLocator;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Base for commands that operate on the process registry. Rejected registry paths exit with the
 * usage code; a corrupt registry is reported and never rewritten.
 */
abstract class RegistryCommand implements Callable<Integer> {

    @Mixin
    RegistryOption registryOption = new RegistryOption();

    protected final RegistryLocator locator;

    protected RegistryCommand(RegistryLocator locator) {
        this.locator = locator;
    }

    @Override
    public Integer call() {
        ProcessRegistry registry;
        try {
            registry = locator.open(registryOption.path);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.USAGE;
        }
        try {
            return run(registry);
        } catch (RegistryCorruptionException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.HALTED;
        }
    }

    protected abstract int run(ProcessRegistry registry);
}
