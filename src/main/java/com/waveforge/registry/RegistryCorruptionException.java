package com.waveforge.registry;

import java.nio.file.Path;

/**
 * Thrown when the on-disk registry cannot be parsed or fails the record schema. The file is left
 * untouched for an operator to inspect.
 */
public class RegistryCorruptionException extends RuntimeException {

    private final Path registryPath;

    public RegistryCorruptionException(Path registryPath, String message) {
        super("Registry " + registryPath + " is corrupt: " + message);
        this.registryPath = registryPath;
    }

    public RegistryCorruptionException(Path registryPath, String message, Throwable cause) {
        super("Registry " + registryPath + " is corrupt: " + message, cause);
        this.registryPath = registryPath;
    }

    public Path registryPath() {
        return registryPath;
    }
}
