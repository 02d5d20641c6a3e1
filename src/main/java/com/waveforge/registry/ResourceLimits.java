package com.waveforge.registry;

/**
 * Container resource limits in docker notation, e.g. {@code 512m} memory and {@code 1.0} CPUs.
 */
public record ResourceLimits(String memory, String cpu) {

    public static ResourceLimits defaults() {
        return new ResourceLimits("512m", "1.0");
    }
}
