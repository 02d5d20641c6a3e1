package com.waveforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Waveforge.
 */
@Command(
        name = "waveforge",
        mixinStandardHelpOptions = true,
        version = "Waveforge 0.1.0",
        description = "Wave scheduler and process watchdog for parallel coding agents",
        subcommands = {
                PlanCommand.class,
                ExecuteCommand.class,
                RunCommand.class,
                WatchdogCommand.class,
                CheckCommand.class,
                KillCommand.class,
                CompleteCommand.class,
                RegisterCommand.class,
                RehydrateCommand.class,
                ReportCommand.class,
                StatsCommand.class,
                CleanupCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WaveforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
