package com.waveforge.core.model;

/**
 * Whether a checkpoint runs after a wave, and the human-readable criterion it verifies.
 */
public record CheckpointPolicy(boolean enabled, String verificationCriteria) {

    public static CheckpointPolicy forWave(int waveId) {
        return new CheckpointPolicy(true,
                "Verify all Wave " + waveId + " tasks are marked [x] in tasks.md");
    }
}
