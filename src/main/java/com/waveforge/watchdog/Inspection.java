package com.waveforge.watchdog;

import com.waveforge.backend.ResourceUsage;
import com.waveforge.watchdog.LivenessProbe.Liveness;

/**
 * Liveness and, for live RUNNING workers, a resource sample.
 *
 * @param liveness    probe result
 * @param usage       resource sample; null when not sampled or sampling failed
 * @param sampleError why sampling failed; null otherwise
 */
public record Inspection(Liveness liveness, ResourceUsage usage, String sampleError) {

    public static Inspection unsampled(Liveness liveness) {
        return new Inspection(liveness, null, null);
    }

    public boolean sampleFailed() {
        return sampleError != null;
    }
}
