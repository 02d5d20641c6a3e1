package com.waveforge.core.engine;

import java.util.List;

/**
 * A wave ended, or timed out, with tasks still not marked complete.
 */
public class VerificationException extends WaveHaltException {

    private final List<String> missingTaskIds;

    public VerificationException(int waveId, List<String> missingTaskIds, String message) {
        super(waveId, message);
        this.missingTaskIds = List.copyOf(missingTaskIds);
    }

    public List<String> missingTaskIds() {
        return missingTaskIds;
    }

    @Override
    public List<String> taskIds() {
        return missingTaskIds;
    }
}
