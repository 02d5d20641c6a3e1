package com.waveforge.registry;

/**
 * Identity of a native process: a pid alone can be recycled by the kernel, so a tracked process
 * is only considered the same process when both pid and start time match.
 */
public record Fingerprint(int pid, String startTime) {

    public boolean matches(Fingerprint live) {
        return live != null && equals(live);
    }
}
