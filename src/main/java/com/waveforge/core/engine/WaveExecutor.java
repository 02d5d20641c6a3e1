package com.waveforge.core.engine;

import com.waveforge.backend.BackendException;
import com.waveforge.collab.CompletionMarkerStore;
import com.waveforge.collab.TaskDispatcher;
import com.waveforge.core.events.EventBus;
import com.waveforge.core.events.EventTypes;
import com.waveforge.core.events.WaveforgeEvent;
import com.waveforge.core.logging.MdcContext;
import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.model.Task;
import com.waveforge.core.model.Wave;
import com.waveforge.core.parser.TaskListException;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RecordStatus;
import com.waveforge.registry.RegistryCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Executes a plan wave by wave: dispatch, wait for completion markers, checkpoint.
 *
 * <p>Control flow is single-threaded; parallelism comes from the workers running out of process.
 * The first failure halts the run. Waves checkpointed before it are not rolled back.
 */
public class WaveExecutor {

    private static final Logger log = LoggerFactory.getLogger(WaveExecutor.class);

    /**
     * @param pollInterval time between completion-marker polls
     * @param waveTimeout  how long a wave may take before it fails verification
     * @param namespace    prefix for registry ids, {@code <namespace>:<taskId>}
     */
    public record Settings(Duration pollInterval, Duration waveTimeout, String namespace) {

        public String registryId(String taskId) {
            return namespace + ":" + taskId;
        }
    }

    private final TaskDispatcher dispatcher;
    private final CompletionMarkerStore markers;
    private final ProcessRegistry registry;
    private final CheckpointService checkpointService;
    private final EventBus eventBus;
    private final WaveforgeMetrics metrics;
    private final Settings settings;

    public WaveExecutor(TaskDispatcher dispatcher, CompletionMarkerStore markers, ProcessRegistry registry,
                        CheckpointService checkpointService, EventBus eventBus, WaveforgeMetrics metrics,
                        Settings settings) {
        this.dispatcher = dispatcher;
        this.markers = markers;
        this.registry = registry;
        this.checkpointService = checkpointService;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
    }

    /**
     * @throws WaveHaltException on the first wave that cannot be completed and checkpointed, including
     *                           a {@link WaveIoException} when the task list or registry fails mid-wave
     */
    public ExecutionReport execute(ExecutionPlan plan) {
        String phaseId = plan.phaseId();
        MdcContext.setPhase(phaseId);
        log.info("Executing phase {}: {} task(s) in {} wave(s)", phaseId, plan.taskCount(), plan.waves().size());

        var results = new ArrayList<ExecutionReport.WaveResult>();
        try {
            for (Wave wave : plan.waves()) {
                try {
                    results.add(executeWave(phaseId, wave));
                } catch (TaskListException | UncheckedIOException | RegistryCorruptionException e) {
                    throw new WaveIoException(wave.id(), wave.taskIds(), e);
                }
            }
        } catch (WaveHaltException e) {
            log.error("Halting phase {} at wave {}: {}", phaseId, e.waveId(), e.getMessage());
            eventBus.publish(WaveforgeEvent.of(EventTypes.RUN_HALTED, phaseId, null, Map.of(
                    "waveId", e.waveId(),
                    "taskIds", e.taskIds(),
                    "reason", String.valueOf(e.getMessage()))));
            throw e;
        } finally {
            MdcContext.clear();
        }

        var report = new ExecutionReport(phaseId, results);
        eventBus.publish(WaveforgeEvent.of(EventTypes.RUN_COMPLETED, phaseId, null, Map.of(
                "waves", report.wavesCompleted(),
                "tasks", report.tasksCompleted())));
        log.info("Phase {} complete: {} wave(s), {} task(s)", phaseId, report.wavesCompleted(),
                report.tasksCompleted());
        return report;
    }

    private ExecutionReport.WaveResult executeWave(String phaseId, Wave wave) {
        int waveId = wave.id();
        MdcContext.setWave(phaseId, waveId);
        log.info("Executing wave {} ({}, {} task(s)): {}", waveId, wave.strategy(), wave.size(), wave.rationale());
        eventBus.publish(WaveforgeEvent.of(EventTypes.WAVE_STARTED, phaseId, null, Map.of(
                "waveId", waveId,
                "strategy", wave.strategy().name(),
                "taskIds", wave.taskIds())));
        if (metrics != null) {
            metrics.recordWaveExecution(wave.size(), wave.strategy().name().toLowerCase(Locale.ROOT));
        }

        Set<String> alreadyDone = markers.completedTaskIds(wave.tasks());
        var dispatched = new ArrayList<String>();
        var skipped = new ArrayList<String>();
        for (Task task : wave.tasks()) {
            if (alreadyDone.contains(task.id())) {
                log.info("{} already marked complete, not dispatching", task.id());
                skipped.add(task.id());
                continue;
            }
            dispatch(phaseId, waveId, task);
            dispatched.add(task.id());
        }

        awaitCompletion(wave);
        eventBus.publish(WaveforgeEvent.of(EventTypes.WAVE_VERIFIED, phaseId, null, Map.of("waveId", waveId)));

        boolean committed = false;
        if (wave.checkpoint().enabled()) {
            committed = checkpointService.checkpoint(wave, () -> markRecordsCompleted(wave));
            eventBus.publish(WaveforgeEvent.of(EventTypes.CHECKPOINT_COMMITTED, phaseId, null, Map.of(
                    "waveId", waveId,
                    "committed", committed)));
        } else {
            log.info("Checkpoint disabled for wave {}", waveId);
            markRecordsCompleted(wave);
        }
        return new ExecutionReport.WaveResult(waveId, dispatched, skipped, committed);
    }

    private void dispatch(String phaseId, int waveId, Task task) {
        MdcContext.setTask(task.id());
        try {
            Optional<ExecutionMode> mode = dispatcher.dispatch(task);
            if (mode.isPresent()) {
                registry.register(settings.registryId(task.id()), mode.get(), task.description(), task.rules());
            }
            eventBus.publish(WaveforgeEvent.of(EventTypes.TASK_DISPATCHED, phaseId, task.id(), Map.of(
                    "waveId", waveId,
                    "role", task.role(),
                    "mode", mode.map(ExecutionMode::label).orElse("handshake"))));
        } catch (BackendException e) {
            throw new DispatchException(waveId, task.id(), e);
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Polls the completion markers until every wave task is complete.
     *
     * @throws VerificationException with the outstanding ids when the wave timeout elapses
     */
    private void awaitCompletion(Wave wave) {
        long deadline = System.nanoTime() + settings.waveTimeout().toNanos();
        List<String> outstanding = outstanding(wave);
        while (!outstanding.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                throw new VerificationException(wave.id(), outstanding,
                        "Wave %d timed out after %ds waiting for %s".formatted(
                                wave.id(), settings.waveTimeout().toSeconds(), String.join(", ", outstanding)));
            }
            log.debug("Wave {} waiting for {}", wave.id(), outstanding);
            try {
                Thread.sleep(settings.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VerificationException(wave.id(), outstanding,
                        "Interrupted while waiting for wave " + wave.id());
            }
            outstanding = outstanding(wave);
        }
        log.info("All {} task(s) of wave {} report complete", wave.size(), wave.id());
    }

    private List<String> outstanding(Wave wave) {
        Set<String> done = markers.completedTaskIds(wave.tasks());
        return wave.taskIds().stream().filter(id -> !done.contains(id)).toList();
    }

    private void markRecordsCompleted(Wave wave) {
        for (String taskId : wave.taskIds()) {
            String registryId = settings.registryId(taskId);
            registry.find(registryId)
                    .filter(r -> r.status() == RecordStatus.RUNNING)
                    .ifPresent(r -> registry.markCompleted(registryId));
        }
    }
}
