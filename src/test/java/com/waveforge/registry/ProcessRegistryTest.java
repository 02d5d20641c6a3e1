package com.waveforge.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ProcessRegistry}.
 */
class ProcessRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");
    private static final ExecutionMode.Native NATIVE = new ExecutionMode.Native(100, 100, "start-0");

    @TempDir
    Path dir;

    private RegistryStore store;
    private ProcessRegistry registry;

    @BeforeEach
    void setUp() {
        store = new RegistryStore(dir.resolve("registry.json"));
        registry = new ProcessRegistry(store, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        @DisplayName("persists a RUNNING record immediately")
        void persistsRunningRecord() {
            registry.register("waveforge:T001", NATIVE, "agent T001", List.of("rule-a"));

            var record = new RegistryStore(store.path()).load().tasks().get("waveforge:T001");
            assertEquals(RecordStatus.RUNNING, record.status());
            assertEquals(T0, record.startedAt());
            assertNull(record.finishedAt());
            assertEquals(List.of("rule-a"), record.rules());
        }

        @Test
        @DisplayName("re-registering replaces the previous record")
        void reRegisterReplaces() {
            registry.register("waveforge:T001", NATIVE, "first", List.of());
            registry.register("waveforge:T001", new ExecutionMode.Native(200, 200, "start-1"), "second", List.of());

            assertEquals(1, registry.snapshot().tasks().size());
            assertEquals("second", registry.find("waveforge:T001").orElseThrow().command());
        }
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("markCompleted sets the terminal status and finish time")
        void markCompleted() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());

            var record = registry.markCompleted("waveforge:T001");

            assertEquals(RecordStatus.COMPLETED, record.status());
            assertEquals(T0, record.finishedAt());
        }

        @Test
        @DisplayName("markFailed records the flag")
        void markFailedWithFlag() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());

            var record = registry.markFailed("waveforge:T001", ProcessRecord.FLAG_ORPHAN);

            assertEquals(RecordStatus.FAILED, record.status());
            assertEquals(List.of(ProcessRecord.FLAG_ORPHAN), record.flags());
        }

        @Test
        @DisplayName("terminal states are final")
        void terminalIsFinal() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            registry.markCompleted("waveforge:T001");

            var record = registry.markFailed("waveforge:T001", ProcessRecord.FLAG_ORPHAN);

            assertEquals(RecordStatus.COMPLETED, record.status());
            assertTrue(record.flags().isEmpty());
        }

        @Test
        @DisplayName("unknown ids are rejected")
        void unknownId() {
            assertThrows(IllegalArgumentException.class, () -> registry.markCompleted("waveforge:T404"));
        }

        @Test
        @DisplayName("flag annotates without changing status and ignores duplicates")
        void flagAnnotates() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            registry.markCompleted("waveforge:T001");

            registry.flag("waveforge:T001", ProcessRecord.FLAG_ZOMBIE_KILLED);
            registry.flag("waveforge:T001", ProcessRecord.FLAG_ZOMBIE_KILLED);

            var record = registry.find("waveforge:T001").orElseThrow();
            assertEquals(RecordStatus.COMPLETED, record.status());
            assertEquals(List.of(ProcessRecord.FLAG_ZOMBIE_KILLED), record.flags());
        }
    }

    @Nested
    @DisplayName("housekeeping")
    class Housekeeping {

        @Test
        @DisplayName("stats count records per status")
        void stats() {
            registry.register("a", NATIVE, "x", List.of());
            registry.register("b", NATIVE, "x", List.of());
            registry.register("c", NATIVE, "x", List.of());
            registry.markCompleted("b");
            registry.markFailed("c", null);

            assertEquals(new RegistryStats(3, 1, 1, 1), registry.stats());
        }

        @Test
        @DisplayName("cleanup removes only terminal records older than the cutoff")
        void cleanup() {
            registry.register("old-done", NATIVE, "x", List.of());
            registry.register("still-running", NATIVE, "x", List.of());
            registry.markCompleted("old-done");

            var later = new ProcessRegistry(store, Clock.fixed(T0.plus(Duration.ofDays(10)), ZoneOffset.UTC));
            later.register("new-done", NATIVE, "x", List.of());
            later.markCompleted("new-done");

            int removed = later.cleanup(Duration.ofDays(7));

            assertEquals(1, removed);
            assertTrue(later.find("old-done").isEmpty());
            assertTrue(later.find("still-running").isPresent());
            assertTrue(later.find("new-done").isPresent());
        }

        @Test
        @DisplayName("remove reports whether a record existed")
        void remove() {
            registry.register("a", NATIVE, "x", List.of());

            assertTrue(registry.remove("a"));
            assertFalse(registry.remove("a"));
        }
    }
}
