package com.waveforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning, wave execution and the watchdog.
 */
@Service
public class WaveforgeMetrics {

    private final MeterRegistry registry;

    public WaveforgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("waveforge.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records when a task is deferred from a wave because a file it locks is already claimed.
     */
    public void recordFileLockDeferral() {
        Counter.builder("waveforge.planning.file_lock_deferrals")
                .description("Tasks deferred to a later wave due to file lock conflicts")
                .register(registry)
                .increment();
    }

    /**
     * Records wave execution metrics for parallel vs sequential analysis.
     *
     * @param taskCount number of tasks in the wave
     * @param strategy  "parallel" or "sequential"
     */
    public void recordWaveExecution(int taskCount, String strategy) {
        Counter.builder("waveforge.wave.executions")
                .description("Wave executions by strategy")
                .tag("strategy", strategy)
                .register(registry)
                .increment();

        DistributionSummary.builder("waveforge.wave.task_count")
                .description("Number of tasks per wave")
                .tag("strategy", strategy)
                .register(registry)
                .record(taskCount);
    }

    /**
     * @param outcome "committed", "verification_failed", "policy_blocked" or "io_failed"
     */
    public void recordCheckpoint(String outcome) {
        Counter.builder("waveforge.checkpoints.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordOrphan(String reason) {
        Counter.builder("waveforge.watchdog.orphans")
                .description("Running records whose worker no longer exists")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordZombieKill(String mode) {
        Counter.builder("waveforge.watchdog.zombie_kills")
                .description("Completed records whose worker was still alive and got killed")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void recordSweep(long ms, int unresolved) {
        Timer.builder("waveforge.watchdog.sweep.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("waveforge.watchdog.sweep.unresolved")
                .description("Records whose inspection timed out or failed during a sweep")
                .register(registry)
                .record(unresolved);
    }
}
