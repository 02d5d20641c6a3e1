package com.waveforge.dispatch.cli;

import com.waveforge.core.events.EventBus;
import com.waveforge.core.events.WaveforgeEvent;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RegistryLocator;
import com.waveforge.watchdog.Watchdog;
import com.waveforge.watchdog.WatchdogFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * CLI command: waveforge watchdog
 * <p>
 * Reconciles the registry against live processes, once or periodically until interrupted.
 * Findings are printed as they are published; the meter summary is printed on exit.
 */
@Command(name = "watchdog", mixinStandardHelpOptions = true,
        description = "Detect orphaned and zombie workers")
@Component
public class WatchdogCommand extends RegistryCommand {

    @Option(names = "--interval", description = "Seconds between sweeps (default: waveforge.watchdog.interval-seconds)")
    private Integer intervalSeconds;

    @Option(names = "--once", description = "Run a single sweep and exit")
    private boolean once;

    private final WatchdogFactory watchdogFactory;
    private final EventBus eventBus;
    private final MeterRegistry meterRegistry;

    public WatchdogCommand(RegistryLocator locator, WatchdogFactory watchdogFactory, EventBus eventBus,
                           MeterRegistry meterRegistry) {
        super(locator);
        this.watchdogFactory = watchdogFactory;
        this.eventBus = eventBus;
        this.meterRegistry = meterRegistry;
    }

    @Override
    protected int run(ProcessRegistry registry) {
        Watchdog.Settings settings = watchdogFactory.settings();
        if (intervalSeconds != null) {
            if (intervalSeconds <= 0) {
                ConsoleOutput.error("--interval must be positive");
                return ExitCodes.USAGE;
            }
            settings = settings.withInterval(Duration.ofSeconds(intervalSeconds));
        }

        ConsoleOutput.printBanner();
        ConsoleOutput.info("Registry: " + registry.store().path());
        try (var findings = eventBus.subscribe(WaveforgeEvent.WATCHDOG_SCOPE, ConsoleOutput::event);
             Watchdog watchdog = watchdogFactory.create(registry, settings)) {
            if (once) {
                ConsoleOutput.reconciliation(watchdog.reconcile());
                ConsoleOutput.metrics(meterRegistry);
                return ExitCodes.OK;
            }
            ConsoleOutput.info("Check interval: " + settings.interval().toSeconds() + "s (Ctrl-C to stop)");
            var stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                watchdog.stop();
                ConsoleOutput.metrics(meterRegistry);
                stopped.countDown();
            }, "waveforge-watchdog-shutdown"));
            watchdog.start();
            stopped.await();
            return ExitCodes.OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExitCodes.OK;
        }
    }
}
