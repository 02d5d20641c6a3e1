package com.waveforge.registry;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Opens the registry at the configured location, or at a per-command override.
 * Every path goes through {@link RegistryPaths#validate}.
 */
public class RegistryLocator {

    private final String defaultPath;
    private final Clock clock;

    public RegistryLocator(String defaultPath, Clock clock) {
        this.defaultPath = defaultPath;
        this.clock = clock;
    }

    /**
     * @param override path given on the command line; null for the configured default
     * @throws IllegalArgumentException if the path is rejected
     */
    public Path resolve(String override) {
        return RegistryPaths.validate(override != null ? override : defaultPath);
    }

    public RegistryStore store(String override) {
        return new RegistryStore(resolve(override));
    }

    public ProcessRegistry open(String override) {
        return new ProcessRegistry(store(override), clock);
    }

    public Clock clock() {
        return clock;
    }
}
