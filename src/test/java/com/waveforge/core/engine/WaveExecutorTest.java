package com.waveforge.core.engine;

import com.waveforge.backend.BackendException;
import com.waveforge.collab.CompletionMarkerStore;
import com.waveforge.collab.TaskDispatcher;
import com.waveforge.core.events.EventBus;
import com.waveforge.core.events.EventTypes;
import com.waveforge.core.events.WaveforgeEvent;
import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.core.model.CheckpointPolicy;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.model.Task;
import com.waveforge.core.model.Wave;
import com.waveforge.core.model.WaveStrategy;
import com.waveforge.core.parser.TaskListException;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RecordStatus;
import com.waveforge.registry.RegistryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link WaveExecutor}. Workers are simulated: a task counts as complete as soon as
 * it has been dispatched, unless a test says otherwise.
 */
class WaveExecutorTest {

    @TempDir
    Path dir;

    private TaskDispatcher dispatcher;
    private CompletionMarkerStore markers;
    private CheckpointService checkpointService;
    private ProcessRegistry registry;
    private EventBus eventBus;
    private List<WaveforgeEvent> events;
    private Set<String> done;
    private WaveExecutor executor;

    @BeforeEach
    void setUp() {
        dispatcher = mock(TaskDispatcher.class);
        markers = mock(CompletionMarkerStore.class);
        checkpointService = mock(CheckpointService.class);
        registry = new ProcessRegistry(new RegistryStore(dir.resolve("registry.json")));
        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribe("phase-1", events::add);
        done = ConcurrentHashMap.newKeySet();

        var pid = new AtomicInteger(1000);
        when(dispatcher.dispatch(any())).thenAnswer(inv -> {
            Task task = inv.getArgument(0);
            done.add(task.id());
            int next = pid.incrementAndGet();
            return Optional.of(new ExecutionMode.Native(next, next, "start-" + next));
        });
        when(markers.completedTaskIds(any())).thenAnswer(inv -> {
            Collection<Task> tasks = inv.getArgument(0);
            return tasks.stream().map(Task::id).filter(done::contains).collect(Collectors.toSet());
        });
        when(checkpointService.checkpoint(any(), any())).thenAnswer(inv -> {
            Runnable onVerified = inv.getArgument(1);
            onVerified.run();
            return true;
        });

        executor = new WaveExecutor(dispatcher, markers, registry, checkpointService, eventBus,
                new WaveforgeMetrics(new SimpleMeterRegistry()),
                new WaveExecutor.Settings(Duration.ofMillis(10), Duration.ofMillis(300), "waveforge"));
    }

    private static Task task(String id) {
        return new Task(id, "do " + id, null, List.of(), List.of(), List.of(), false);
    }

    private static Wave wave(int id, Task... tasks) {
        return new Wave(id, WaveStrategy.forSize(tasks.length), List.of(tasks), "r", CheckpointPolicy.forWave(id));
    }

    private ExecutionPlan twoWavePlan() {
        return new ExecutionPlan("phase-1", List.of(
                wave(1, task("T001"), task("T003")),
                wave(2, task("T002"))));
    }

    private List<String> eventTypes() {
        return events.stream().map(WaveforgeEvent::eventType).toList();
    }

    @Nested
    @DisplayName("successful run")
    class SuccessfulRun {

        @Test
        @DisplayName("dispatches, verifies and checkpoints every wave in order")
        void runsAllWaves() {
            var report = executor.execute(twoWavePlan());

            assertEquals(2, report.wavesCompleted());
            assertEquals(3, report.tasksCompleted());
            assertEquals(List.of("T001", "T003"), report.waves().get(0).dispatched());
            assertTrue(report.waves().get(1).committed());

            var order = inOrder(dispatcher, checkpointService);
            order.verify(dispatcher).dispatch(task("T001"));
            order.verify(dispatcher).dispatch(task("T003"));
            order.verify(checkpointService).checkpoint(eq(twoWavePlan().waves().get(0)), any());
            order.verify(dispatcher).dispatch(task("T002"));
            order.verify(checkpointService).checkpoint(eq(twoWavePlan().waves().get(1)), any());
        }

        @Test
        @DisplayName("registers dispatched workers and completes them at the checkpoint")
        void registersWorkers() {
            executor.execute(twoWavePlan());

            var records = registry.snapshot().tasks();
            assertEquals(Set.of("waveforge:T001", "waveforge:T002", "waveforge:T003"), records.keySet());
            records.values().forEach(r -> assertEquals(RecordStatus.COMPLETED, r.status()));
            assertEquals("do T001", records.get("waveforge:T001").command());
        }

        @Test
        @DisplayName("publishes wave lifecycle events")
        void publishesEvents() {
            executor.execute(new ExecutionPlan("phase-1", List.of(wave(1, task("T001")))));

            assertEquals(List.of(EventTypes.WAVE_STARTED, EventTypes.TASK_DISPATCHED, EventTypes.WAVE_VERIFIED,
                    EventTypes.CHECKPOINT_COMMITTED, EventTypes.RUN_COMPLETED), eventTypes());
            assertEquals("native", events.get(1).payload().get("mode"));
        }

        @Test
        @DisplayName("tasks already marked complete are not dispatched again")
        void skipsCompletedTasks() {
            done.add("T001");

            var report = executor.execute(twoWavePlan());

            verify(dispatcher, never()).dispatch(task("T001"));
            assertEquals(List.of("T001"), report.waves().get(0).skipped());
            assertEquals(List.of("T003"), report.waves().get(0).dispatched());
            assertTrue(registry.find("waveforge:T001").isEmpty());
        }

        @Test
        @DisplayName("handshake dispatch registers nothing")
        void handshakeDispatch() {
            when(dispatcher.dispatch(any())).thenAnswer(inv -> {
                done.add(((Task) inv.getArgument(0)).id());
                return Optional.empty();
            });

            executor.execute(twoWavePlan());

            assertTrue(registry.snapshot().tasks().isEmpty());
        }

        @Test
        @DisplayName("a wave without checkpoint completes its records directly")
        void checkpointDisabled() {
            var noCheckpoint = new Wave(1, WaveStrategy.SEQUENTIAL, List.of(task("T001")), "r",
                    new CheckpointPolicy(false, ""));

            var report = executor.execute(new ExecutionPlan("phase-1", List.of(noCheckpoint)));

            verifyNoInteractions(checkpointService);
            assertFalse(report.waves().get(0).committed());
            assertEquals(RecordStatus.COMPLETED, registry.find("waveforge:T001").orElseThrow().status());
        }
    }

    @Nested
    @DisplayName("halting")
    class Halting {

        @Test
        @DisplayName("a wave that never completes times out and stops the run")
        void waveTimeout() {
            when(dispatcher.dispatch(any())).thenReturn(Optional.empty());

            var ex = assertThrows(VerificationException.class, () -> executor.execute(twoWavePlan()));

            assertEquals(1, ex.waveId());
            assertEquals(List.of("T001", "T003"), ex.missingTaskIds());
            assertTrue(ex.getMessage().contains("timed out"));
            verifyNoInteractions(checkpointService);
            verify(dispatcher, never()).dispatch(task("T002"));
            var halted = events.get(events.size() - 1);
            assertEquals(EventTypes.RUN_HALTED, halted.eventType());
            assertEquals(List.of("T001", "T003"), halted.payload().get("taskIds"));
        }

        @Test
        @DisplayName("a backend failure during dispatch halts with the task id")
        void dispatchFailure() {
            when(dispatcher.dispatch(task("T003"))).thenThrow(new BackendException("setsid: not found"));

            var ex = assertThrows(DispatchException.class, () -> executor.execute(twoWavePlan()));

            assertEquals(1, ex.waveId());
            assertEquals(List.of("T003"), ex.taskIds());
            assertInstanceOf(BackendException.class, ex.getCause());
        }

        @Test
        @DisplayName("an unreadable task list while polling halts with the wave's task ids")
        void taskListFailure() {
            when(markers.completedTaskIds(any()))
                    .thenReturn(Set.of())
                    .thenThrow(new TaskListException("Task list not found: tasks.md"));

            var ex = assertThrows(WaveIoException.class, () -> executor.execute(twoWavePlan()));

            assertEquals(1, ex.waveId());
            assertEquals(List.of("T001", "T003"), ex.taskIds());
            assertInstanceOf(TaskListException.class, ex.getCause());
            verifyNoInteractions(checkpointService);
            var halted = events.get(events.size() - 1);
            assertEquals(EventTypes.RUN_HALTED, halted.eventType());
            assertEquals(1, halted.payload().get("waveId"));
            assertEquals(List.of("T001", "T003"), halted.payload().get("taskIds"));
        }

        @Test
        @DisplayName("a registry write failure halts the run with the wave's task ids")
        void registryWriteFailure() {
            when(markers.completedTaskIds(any())).thenThrow(
                    new UncheckedIOException("disk full", new IOException("No space left on device")));

            var ex = assertThrows(WaveIoException.class,
                    () -> executor.execute(new ExecutionPlan("phase-1", List.of(wave(1, task("T001"))))));

            assertEquals(List.of("T001"), ex.taskIds());
            assertTrue(ex.getMessage().contains("disk full"));
            assertTrue(eventTypes().contains(EventTypes.RUN_HALTED));
            assertFalse(eventTypes().contains(EventTypes.RUN_COMPLETED));
        }

        @Test
        @DisplayName("a failed checkpoint stops later waves and keeps their records untouched")
        void checkpointFailure() {
            when(checkpointService.checkpoint(any(), any())).thenThrow(
                    new PolicyViolationException(1, List.of("T001", "T003"), List.of()));

            assertThrows(PolicyViolationException.class, () -> executor.execute(twoWavePlan()));

            verify(dispatcher, never()).dispatch(task("T002"));
            assertEquals(RecordStatus.RUNNING, registry.find("waveforge:T001").orElseThrow().status());
            assertTrue(eventTypes().contains(EventTypes.RUN_HALTED));
            assertFalse(eventTypes().contains(EventTypes.RUN_COMPLETED));
        }
    }
}
