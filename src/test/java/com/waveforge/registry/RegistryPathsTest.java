package com.waveforge.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RegistryPathsTest {

    @Test
    @DisplayName("resolves a relative path against the working directory")
    void resolvesRelative() {
        Path resolved = RegistryPaths.validate(".waveforge/registry.json");

        assertTrue(resolved.isAbsolute());
        assertTrue(resolved.endsWith(Path.of(".waveforge", "registry.json")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"../registry.json", "state/../../registry.json", "/etc/waveforge.json",
            "/proc/self/registry.json", "/dev/registry.json", " "})
    @DisplayName("rejects traversal, system directories and blank paths")
    void rejects(String raw) {
        assertThrows(IllegalArgumentException.class, () -> RegistryPaths.validate(raw));
    }
}
