package com.waveforge.core.engine;

import java.util.List;

/**
 * Base class for failures that halt a run after a wave started. Waves checkpointed before the
 * failure stay committed; nothing is retried.
 */
public abstract class WaveHaltException extends RuntimeException {

    private final int waveId;

    protected WaveHaltException(int waveId, String message) {
        super(message);
        this.waveId = waveId;
    }

    protected WaveHaltException(int waveId, String message, Throwable cause) {
        super(message, cause);
        this.waveId = waveId;
    }

    public int waveId() {
        return waveId;
    }

    /**
     * @return ids of the tasks that triggered the halt; may be empty
     */
    public abstract List<String> taskIds();
}
