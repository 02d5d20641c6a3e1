package com.waveforge.watchdog;

import com.waveforge.backend.ContainerBackend;
import com.waveforge.backend.ProcessBackend;
import com.waveforge.core.events.EventBus;
import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.registry.ProcessRegistry;

import java.time.Clock;

/**
 * Builds watchdogs bound to a particular registry; the CLI can point each command at a different file.
 */
public class WatchdogFactory {

    private final ProcessBackend processes;
    private final ContainerBackend containers;
    private final EventBus eventBus;
    private final WaveforgeMetrics metrics;
    private final Watchdog.Settings settings;
    private final Clock clock;

    /**
     * @param containers may be null when containers are not in use
     */
    public WatchdogFactory(ProcessBackend processes, ContainerBackend containers, EventBus eventBus,
                           WaveforgeMetrics metrics, Watchdog.Settings settings, Clock clock) {
        this.processes = processes;
        this.containers = containers;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    public Watchdog create(ProcessRegistry registry) {
        return create(registry, settings);
    }

    public Watchdog create(ProcessRegistry registry, Watchdog.Settings overrides) {
        return new Watchdog(registry, new LivenessProbe(processes, containers), processes, containers, eventBus,
                metrics, overrides, clock);
    }

    public Watchdog.Settings settings() {
        return settings;
    }
}
