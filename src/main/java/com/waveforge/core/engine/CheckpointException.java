package com.waveforge.core.engine;

import java.util.List;

/**
 * A checkpoint step failed for reasons other than verification or policy: the progress record
 * could not be written or the commit failed.
 */
public class CheckpointException extends WaveHaltException {

    public static final String STEP_PROGRESS = "progress";
    public static final String STEP_POLICY = "policy";
    public static final String STEP_COMMIT = "commit";

    private final String step;
    private final List<String> waveTaskIds;

    public CheckpointException(int waveId, String step, List<String> waveTaskIds, String message, Throwable cause) {
        super(waveId, message, cause);
        this.step = step;
        this.waveTaskIds = List.copyOf(waveTaskIds);
    }

    public String step() {
        return step;
    }

    @Override
    public List<String> taskIds() {
        return waveTaskIds;
    }
}
