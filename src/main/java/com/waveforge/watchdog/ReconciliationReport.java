package com.waveforge.watchdog;

import com.waveforge.backend.ResourceUsage;
import com.waveforge.registry.RegistryStats;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one watchdog sweep.
 *
 * @param orphans        RUNNING records whose worker was gone, now FAILED
 * @param zombies        COMPLETED records whose worker was still alive, now killed
 * @param samples        resource usage of live RUNNING workers
 * @param sampleFailures live RUNNING workers that could not be sampled
 * @param overruns       RUNNING workers past the overrun threshold
 * @param unresolved     records whose inspection timed out or failed; left unchanged
 * @param stats          registry totals after the sweep
 * @param duration       wall time of the sweep
 */
public record ReconciliationReport(
    List<String> orphans,
    List<String> zombies,
    Map<String, ResourceUsage> samples,
    List<String> sampleFailures,
    List<String> overruns,
    List<String> unresolved,
    RegistryStats stats,
    Duration duration
) {

    public ReconciliationReport {
        orphans = List.copyOf(orphans);
        zombies = List.copyOf(zombies);
        samples = Map.copyOf(samples);
        sampleFailures = List.copyOf(sampleFailures);
        overruns = List.copyOf(overruns);
        unresolved = List.copyOf(unresolved);
    }

    public boolean hasIssues() {
        return !orphans.isEmpty() || !zombies.isEmpty() || !unresolved.isEmpty();
    }
}
