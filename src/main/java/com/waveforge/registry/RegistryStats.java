package com.waveforge.registry;

/**
 * Record counts per status.
 */
public record RegistryStats(int total, int running, int completed, int failed) {

    public static RegistryStats of(RegistryDocument document) {
        int running = 0;
        int completed = 0;
        int failed = 0;
        for (ProcessRecord record : document.tasks().values()) {
            switch (record.status()) {
                case RUNNING -> running++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new RegistryStats(document.tasks().size(), running, completed, failed);
    }
}
