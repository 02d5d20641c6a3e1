package com.waveforge.backend;

/**
 * Point-in-time resource sample of a worker.
 */
public record ResourceUsage(double cpuPercent, long memoryKb) {

    public long memoryMb() {
        return memoryKb / 1024;
    }
}
