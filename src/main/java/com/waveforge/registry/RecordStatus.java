package com.waveforge.registry;

/**
 * Lifecycle of a registry record: {@code RUNNING -> COMPLETED | FAILED}. Both terminal states are final.
 */
public enum RecordStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
