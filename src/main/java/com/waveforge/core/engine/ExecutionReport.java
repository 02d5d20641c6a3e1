package com.waveforge.core.engine;

import java.util.List;

/**
 * What a successful run did.
 */
public record ExecutionReport(String phaseId, List<WaveResult> waves) {

    /**
     * @param dispatched tasks handed to a worker in this run
     * @param skipped    tasks already marked complete before the wave started
     * @param committed  whether the checkpoint created a commit
     */
    public record WaveResult(int waveId, List<String> dispatched, List<String> skipped, boolean committed) {

        public WaveResult {
            dispatched = List.copyOf(dispatched);
            skipped = List.copyOf(skipped);
        }
    }

    public ExecutionReport {
        waves = List.copyOf(waves);
    }

    public int wavesCompleted() {
        return waves.size();
    }

    public int tasksCompleted() {
        return waves.stream().mapToInt(w -> w.dispatched().size() + w.skipped().size()).sum();
    }
}
