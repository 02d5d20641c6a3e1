package com.waveforge.registry;

import java.nio.file.Path;
import java.util.List;

/**
 * Guards the registry location supplied on the command line or in configuration.
 */
public final class RegistryPaths {

    private static final List<String> FORBIDDEN_PREFIXES = List.of("/etc", "/sys", "/proc", "/boot", "/dev");

    private RegistryPaths() {}

    /**
     * @throws IllegalArgumentException if the path contains {@code ..} or points into a system directory
     */
    public static Path validate(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("Registry path must not be empty");
        }
        Path path = Path.of(rawPath);
        for (Path part : path) {
            if ("..".equals(part.toString())) {
                throw new IllegalArgumentException(
                        "Registry path cannot contain parent directory references (..): " + rawPath);
            }
        }
        Path absolute = path.toAbsolutePath().normalize();
        for (String prefix : FORBIDDEN_PREFIXES) {
            if (absolute.startsWith(prefix)) {
                throw new IllegalArgumentException("Registry path cannot be in system directory " + prefix);
            }
        }
        return absolute;
    }
}
