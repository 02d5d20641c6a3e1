package com.waveforge.watchdog;

import com.waveforge.backend.BackendException;
import com.waveforge.backend.ContainerBackend;
import com.waveforge.backend.ProcessBackend;
import com.waveforge.backend.ResourceUsage;
import com.waveforge.core.events.EventBus;
import com.waveforge.core.events.EventTypes;
import com.waveforge.core.events.WaveforgeEvent;
import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.Fingerprint;
import com.waveforge.registry.ProcessRecord;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RecordStatus;
import com.waveforge.registry.RegistryStore;
import com.waveforge.registry.ResourceLimits;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
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
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link Watchdog}, with the process and container backends mocked.
 */
class WatchdogTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");
    private static final String START = "2026-01-05T09:59:59Z";
    private static final ExecutionMode.Native NATIVE = new ExecutionMode.Native(1234, 1234, START);
    private static final Duration GRACE = Duration.ofMillis(10);

    @TempDir
    Path dir;

    private ProcessBackend processes;
    private ContainerBackend containers;
    private ProcessRegistry registry;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private List<WaveforgeEvent> events;
    private Watchdog watchdog;

    @BeforeEach
    void setUp() {
        processes = mock(ProcessBackend.class);
        containers = mock(ContainerBackend.class);
        registry = new ProcessRegistry(new RegistryStore(dir.resolve("registry.json")),
                Clock.fixed(T0, ZoneOffset.UTC));
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(WaveforgeEvent.WATCHDOG_SCOPE, events::add);
        meterRegistry = new SimpleMeterRegistry();
        watchdog = watchdogAt(T0.plus(Duration.ofMinutes(1)), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        watchdog.close();
    }

    private Watchdog watchdogAt(Instant now, Duration inspectionTimeout) {
        var settings = new Watchdog.Settings(Duration.ofMinutes(5), inspectionTimeout, GRACE, Duration.ofMinutes(15));
        return new Watchdog(registry, new LivenessProbe(processes, containers), processes, containers, eventBus,
                new WaveforgeMetrics(meterRegistry), settings, Clock.fixed(now, ZoneOffset.UTC));
    }

    private List<WaveforgeEvent> eventsOfType(String type) {
        return events.stream().filter(e -> e.eventType().equals(type)).toList();
    }

    @Nested
    @DisplayName("orphans")
    class Orphans {

        @Test
        @DisplayName("a RUNNING record whose pid is gone becomes FAILED with exactly one event")
        void deadPid() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.empty());

            var report = watchdog.reconcile();

            assertEquals(List.of("waveforge:T001"), report.orphans());
            var record = registry.find("waveforge:T001").orElseThrow();
            assertEquals(RecordStatus.FAILED, record.status());
            assertEquals(List.of(ProcessRecord.FLAG_ORPHAN), record.flags());
            var orphanEvents = eventsOfType(EventTypes.ORPHAN_DETECTED);
            assertEquals(1, orphanEvents.size());
            assertEquals("waveforge:T001", orphanEvents.get(0).taskId());
            assertEquals(ProcessRecord.FLAG_ORPHAN, orphanEvents.get(0).payload().get("reason"));
            assertEquals(1.0, meterRegistry.counter("waveforge.watchdog.orphans", "reason", "orphan").count());
        }

        @Test
        @DisplayName("a second sweep does not report the same orphan again")
        void reportedOnce() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.empty());

            watchdog.reconcile();
            var second = watchdog.reconcile();

            assertTrue(second.orphans().isEmpty());
            assertEquals(1, eventsOfType(EventTypes.ORPHAN_DETECTED).size());
        }

        @Test
        @DisplayName("a live pid with a different start time is treated as reused")
        void pidReused() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.of(new Fingerprint(1234, "2026-01-05T11:30:00Z")));

            var report = watchdog.reconcile();

            assertEquals(List.of("waveforge:T001"), report.orphans());
            var record = registry.find("waveforge:T001").orElseThrow();
            assertEquals(RecordStatus.FAILED, record.status());
            assertEquals(List.of(ProcessRecord.FLAG_PID_REUSED), record.flags());
            verify(processes, never()).killGroup(anyInt(), any());
        }

        @Test
        @DisplayName("a stopped container is an orphan")
        void containerGone() {
            registry.register("waveforge:T002",
                    new ExecutionMode.Container("c0ffee0123456789", "waveforge-t002", ResourceLimits.defaults()),
                    "agent", List.of());
            when(containers.isRunning("c0ffee0123456789")).thenReturn(false);

            var report = watchdog.reconcile();

            assertEquals(List.of("waveforge:T002"), report.orphans());
            assertEquals("container", eventsOfType(EventTypes.ORPHAN_DETECTED).get(0).payload().get("mode"));
        }
    }

    @Nested
    @DisplayName("zombies")
    class Zombies {

        @Test
        @DisplayName("a COMPLETED record whose group is alive is killed exactly once")
        void killsZombieGroupOnce() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            registry.markCompleted("waveforge:T001");
            var killed = new AtomicBoolean(false);
            when(processes.fingerprint(1234)).thenAnswer(inv ->
                    killed.get() ? Optional.empty() : Optional.of(NATIVE.fingerprint()));
            doAnswer(inv -> {
                killed.set(true);
                return null;
            }).when(processes).killGroup(1234, GRACE);

            var first = watchdog.reconcile();
            var second = watchdog.reconcile();

            assertEquals(List.of("waveforge:T001"), first.zombies());
            assertTrue(second.zombies().isEmpty());
            verify(processes, times(1)).killGroup(1234, GRACE);
            var record = registry.find("waveforge:T001").orElseThrow();
            assertEquals(RecordStatus.COMPLETED, record.status());
            assertTrue(record.flags().contains(ProcessRecord.FLAG_ZOMBIE_KILLED));
            assertEquals(1, eventsOfType(EventTypes.ZOMBIE_DETECTED).size());
        }

        @Test
        @DisplayName("a COMPLETED record whose container still runs is killed through the container backend")
        void killsZombieContainer() {
            registry.register("waveforge:T002",
                    new ExecutionMode.Container("c0ffee0123456789", "waveforge-t002", ResourceLimits.defaults()),
                    "agent", List.of());
            registry.markCompleted("waveforge:T002");
            when(containers.isRunning("c0ffee0123456789")).thenReturn(true);

            var report = watchdog.reconcile();

            assertEquals(List.of("waveforge:T002"), report.zombies());
            verify(containers).kill("c0ffee0123456789");
            verify(processes, never()).killGroup(anyInt(), any());
        }

        @Test
        @DisplayName("a COMPLETED record whose pid was reused is left alone")
        void reusedPidNotKilled() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            registry.markCompleted("waveforge:T001");
            when(processes.fingerprint(1234)).thenReturn(Optional.of(new Fingerprint(1234, "other")));

            var report = watchdog.reconcile();

            assertTrue(report.zombies().isEmpty());
            verify(processes, never()).killGroup(anyInt(), any());
        }

        @Test
        @DisplayName("a failing kill leaves the record unresolved")
        void killFailure() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            registry.markCompleted("waveforge:T001");
            when(processes.fingerprint(1234)).thenReturn(Optional.of(NATIVE.fingerprint()));
            doThrow(new BackendException("operation not permitted")).when(processes).killGroup(1234, GRACE);

            var report = watchdog.reconcile();

            assertEquals(List.of("waveforge:T001"), report.unresolved());
            assertTrue(report.zombies().isEmpty());
            assertFalse(registry.find("waveforge:T001").orElseThrow().flags().contains(ProcessRecord.FLAG_ZOMBIE_KILLED));
        }
    }

    @Nested
    @DisplayName("inspection")
    class Inspections {

        @Test
        @DisplayName("a hung inspection is bounded by the timeout and leaves the record untouched")
        void hungInspection() throws Exception {
            watchdog.close();
            watchdog = watchdogAt(T0, Duration.ofMillis(200));
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            registry.register("waveforge:T002", new ExecutionMode.Native(99, 99, START), "agent", List.of());
            var release = new CountDownLatch(1);
            when(processes.fingerprint(1234)).thenAnswer(inv -> {
                release.await(10, TimeUnit.SECONDS);
                return Optional.empty();
            });
            when(processes.fingerprint(99)).thenReturn(Optional.empty());

            long start = System.nanoTime();
            var report = watchdog.reconcile();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            release.countDown();

            assertTrue(elapsedMs < 5_000, "sweep took " + elapsedMs + "ms");
            assertEquals(List.of("waveforge:T001"), report.unresolved());
            assertEquals(List.of("waveforge:T002"), report.orphans());
            assertEquals(RecordStatus.RUNNING, registry.find("waveforge:T001").orElseThrow().status());
        }

        @Test
        @DisplayName("inspections that ignore interrupts never occupy more than the fixed pool")
        void stuckInspectionsAreNotResubmitted() {
            watchdog.close();
            watchdog = watchdogAt(T0, Duration.ofMillis(100));
            int records = Watchdog.INSPECTOR_THREADS + 2;
            for (int i = 0; i < records; i++) {
                registry.register("waveforge:T00" + i, new ExecutionMode.Native(500 + i, 500 + i, START),
                        "agent", List.of());
            }
            var released = new AtomicBoolean(false);
            var calls = new AtomicInteger();
            var inFlight = new AtomicInteger();
            var maxInFlight = new AtomicInteger();
            when(processes.fingerprint(anyInt())).thenAnswer(inv -> {
                calls.incrementAndGet();
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    while (!released.get()) {
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException ignored) {
                            // keeps the thread busy the way a wedged backend call would
                        }
                    }
                    return Optional.empty();
                } finally {
                    inFlight.decrementAndGet();
                }
            });

            try {
                for (int sweep = 0; sweep < 3; sweep++) {
                    var report = watchdog.reconcile();
                    assertEquals(records, report.unresolved().size());
                    assertTrue(report.orphans().isEmpty());
                }

                assertEquals(Watchdog.INSPECTOR_THREADS, calls.get());
                assertEquals(Watchdog.INSPECTOR_THREADS, maxInFlight.get());
                for (int i = 0; i < records; i++) {
                    assertEquals(RecordStatus.RUNNING, registry.find("waveforge:T00" + i).orElseThrow().status());
                }
            } finally {
                released.set(true);
            }
        }

        @Test
        @DisplayName("a failing sample is reported without stopping the sweep")
        void sampleFailure() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            var other = new ExecutionMode.Native(2000, 2000, START);
            registry.register("waveforge:T002", other, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.of(NATIVE.fingerprint()));
            when(processes.fingerprint(2000)).thenReturn(Optional.of(other.fingerprint()));
            when(processes.sample(1234)).thenThrow(new BackendException("ps failed"));
            when(processes.sample(2000)).thenReturn(new ResourceUsage(12.5, 204800));

            var report = watchdog.reconcile();

            assertEquals(List.of("waveforge:T001"), report.sampleFailures());
            assertEquals(new ResourceUsage(12.5, 204800), report.samples().get("waveforge:T002"));
            assertTrue(report.orphans().isEmpty());
            assertEquals(1, eventsOfType(EventTypes.SAMPLE_FAILED).size());
            assertEquals(RecordStatus.RUNNING, registry.find("waveforge:T001").orElseThrow().status());
        }

        @Test
        @DisplayName("failed records are not inspected")
        void skipsFailed() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            registry.markFailed("waveforge:T001", null);

            var report = watchdog.reconcile();

            verifyNoInteractions(processes);
            assertFalse(report.hasIssues());
            assertEquals(1, report.stats().failed());
        }
    }

    @Nested
    @DisplayName("overrun")
    class Overrun {

        @Test
        @DisplayName("a long-running task is warned about once per watchdog")
        void warnsOnce() {
            watchdog.close();
            watchdog = watchdogAt(T0.plus(Duration.ofMinutes(20)), Duration.ofSeconds(2));
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.of(NATIVE.fingerprint()));
            when(processes.sample(1234)).thenReturn(new ResourceUsage(1.0, 1024));

            var first = watchdog.reconcile();
            var second = watchdog.reconcile();

            assertEquals(List.of("waveforge:T001"), first.overruns());
            assertEquals(List.of("waveforge:T001"), second.overruns());
            var overrunEvents = eventsOfType(EventTypes.TASK_OVERRUN);
            assertEquals(1, overrunEvents.size());
            assertEquals(20L, overrunEvents.get(0).payload().get("elapsedMinutes"));
        }

        @Test
        @DisplayName("a task below the threshold is not an overrun")
        void belowThreshold() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.of(NATIVE.fingerprint()));
            when(processes.sample(1234)).thenReturn(new ResourceUsage(1.0, 1024));

            assertTrue(watchdog.reconcile().overruns().isEmpty());
        }
    }

    @Nested
    @DisplayName("kill")
    class Kill {

        @Test
        @DisplayName("kills the group and marks a RUNNING record FAILED")
        void killRunning() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.of(NATIVE.fingerprint()));

            var record = watchdog.kill("waveforge:T001");

            verify(processes).killGroup(1234, GRACE);
            assertEquals(RecordStatus.FAILED, record.status());
            assertEquals(List.of(ProcessRecord.FLAG_KILLED), record.flags());
        }

        @Test
        @DisplayName("does not signal a group whose pid now belongs to another process")
        void pidReused() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.of(new Fingerprint(1234, "2026-01-05T11:30:00Z")));

            var record = watchdog.kill("waveforge:T001");

            verify(processes, never()).killGroup(anyInt(), any());
            assertEquals(RecordStatus.FAILED, record.status());
            assertEquals(List.of(ProcessRecord.FLAG_PID_REUSED), record.flags());
        }

        @Test
        @DisplayName("settles the record of a worker that already exited without signalling")
        void alreadyExited() {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            when(processes.fingerprint(1234)).thenReturn(Optional.empty());

            var record = watchdog.kill("waveforge:T001");

            verify(processes, never()).killGroup(anyInt(), any());
            assertEquals(RecordStatus.FAILED, record.status());
            assertEquals(List.of(ProcessRecord.FLAG_KILLED), record.flags());
        }

        @Test
        @DisplayName("containers are killed through the container backend")
        void killContainer() {
            registry.register("waveforge:T002",
                    new ExecutionMode.Container("abc123def456", "waveforge-t002", ResourceLimits.defaults()),
                    "agent", List.of());

            var record = watchdog.kill("waveforge:T002");

            verify(containers).kill("abc123def456");
            assertEquals(RecordStatus.FAILED, record.status());
        }

        @Test
        @DisplayName("rejects unknown ids")
        void unknown() {
            assertThrows(IllegalArgumentException.class, () -> watchdog.kill("waveforge:T404"));
            verifyNoInteractions(processes);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("start runs a sweep immediately and stop ends the schedule")
        void startAndStop() throws Exception {
            registry.register("waveforge:T001", NATIVE, "agent", List.of());
            var swept = new CountDownLatch(1);
            when(processes.fingerprint(1234)).thenAnswer(inv -> {
                swept.countDown();
                return Optional.empty();
            });

            watchdog.start();
            assertTrue(watchdog.isRunning());
            assertTrue(swept.await(5, TimeUnit.SECONDS));
            watchdog.stop();

            assertFalse(watchdog.isRunning());
        }
    }
}
