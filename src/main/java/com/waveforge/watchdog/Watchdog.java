package com.waveforge.watchdog;

import com.waveforge.backend.BackendException;
import com.waveforge.backend.ContainerBackend;
import com.waveforge.backend.ProcessBackend;
import com.waveforge.backend.ResourceUsage;
import com.waveforge.core.events.EventBus;
import com.waveforge.core.events.EventTypes;
import com.waveforge.core.events.WaveforgeEvent;
import com.waveforge.core.logging.MdcContext;
import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.ProcessRecord;
import com.waveforge.registry.ProcessRegistry;
import com.waveforge.registry.RecordStatus;
import com.waveforge.registry.RegistryDocument;
import com.waveforge.watchdog.LivenessProbe.Liveness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reconciles the process registry against the live system.
 *
 * <p>Each sweep reads the registry from disk and inspects every RUNNING and COMPLETED record:
 * <ul>
 *   <li>RUNNING but gone: marked FAILED and flagged {@code orphan} (or {@code pid-reused})</li>
 *   <li>COMPLETED but alive: the process group or container is killed and flagged {@code zombie-killed}</li>
 *   <li>RUNNING and alive: sampled, and warned about once when past the overrun threshold</li>
 * </ul>
 * Inspections run on a fixed pool of {@value #INSPECTOR_THREADS} threads and are bounded by a timeout.
 * A record whose inspection does not finish is left untouched, and is not inspected again while
 * that inspection still occupies a thread.
 *
 * <p>Uses a single-threaded scheduler so sweeps never overlap.
 */
public class Watchdog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    static final int INSPECTOR_THREADS = 4;

    /**
     * @param interval           time between sweeps
     * @param inspectionTimeout  upper bound for probing and sampling one record
     * @param killGrace          time between SIGTERM and SIGKILL for a zombie process group
     * @param overrunThreshold   RUNNING time after which an overrun warning is published
     */
    public record Settings(Duration interval, Duration inspectionTimeout, Duration killGrace,
                           Duration overrunThreshold) {

        public static Settings defaults() {
            return new Settings(Duration.ofMinutes(5), Duration.ofSeconds(10), Duration.ofSeconds(2),
                    Duration.ofMinutes(15));
        }

        public Settings withInterval(Duration newInterval) {
            return new Settings(newInterval, inspectionTimeout, killGrace, overrunThreshold);
        }
    }

    private final ProcessRegistry registry;
    private final LivenessProbe probe;
    private final ProcessBackend processes;
    private final ContainerBackend containers;
    private final EventBus eventBus;
    private final WaveforgeMetrics metrics;
    private final Settings settings;
    private final Clock clock;

    private final ExecutorService inspectors;
    /** Records whose inspection currently occupies an inspector thread, cancelled or not. */
    private final Set<String> inspecting = ConcurrentHashMap.newKeySet();
    private final Set<String> overrunWarned = ConcurrentHashMap.newKeySet();
    private ScheduledExecutorService scheduler;

    private volatile boolean running = false;

    /**
     * @param containers may be null when containers are not in use
     * @param metrics    may be null
     */
    public Watchdog(ProcessRegistry registry, LivenessProbe probe, ProcessBackend processes,
                    ContainerBackend containers, EventBus eventBus, WaveforgeMetrics metrics,
                    Settings settings, Clock clock) {
        this.registry = registry;
        this.probe = probe;
        this.processes = processes;
        this.containers = containers;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        var counter = new AtomicInteger();
        this.inspectors = Executors.newFixedThreadPool(INSPECTOR_THREADS, r -> {
            Thread t = new Thread(r, "waveforge-inspector-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Settings settings() {
        return settings;
    }

    /**
     * Starts periodic sweeps, the first one immediately.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Watchdog already running");
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "waveforge-watchdog");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = settings.interval().toMillis();
        scheduler.scheduleAtFixedRate(this::sweepSafely, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Watchdog started, sweeping {} every {}ms", registry.store().path(), intervalMs);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
                log.warn("Watchdog forcefully stopped");
            } else {
                log.info("Watchdog stopped gracefully");
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
        inspectors.shutdownNow();
    }

    /**
     * Runs one sweep.
     *
     * @throws com.waveforge.registry.RegistryCorruptionException if the registry cannot be read
     */
    public ReconciliationReport reconcile() {
        long start = System.currentTimeMillis();
        RegistryDocument document = registry.snapshot();

        var candidates = new ArrayList<ProcessRecord>();
        for (ProcessRecord record : document.tasks().values()) {
            if (record.status() != RecordStatus.FAILED) {
                candidates.add(record);
            }
        }

        var unresolved = new ArrayList<String>();
        var pending = new LinkedHashMap<ProcessRecord, Future<Inspection>>();
        for (ProcessRecord record : candidates) {
            if (inspecting.contains(record.taskId())) {
                log.warn("Previous inspection of {} is still running, skipping it this sweep", record.taskId());
                unresolved.add(record.taskId());
                continue;
            }
            pending.put(record, inspectors.submit(() -> inspectTracked(record)));
        }

        var orphans = new ArrayList<String>();
        var zombies = new ArrayList<String>();
        var samples = new LinkedHashMap<String, ResourceUsage>();
        var sampleFailures = new ArrayList<String>();
        var overruns = new ArrayList<String>();

        Instant deadlineBase = Instant.now();
        for (Map.Entry<ProcessRecord, Future<Inspection>> entry : pending.entrySet()) {
            ProcessRecord record = entry.getKey();
            MdcContext.setTask(record.taskId());
            try {
                Inspection inspection = await(record, entry.getValue(), deadlineBase);
                if (inspection == null) {
                    unresolved.add(record.taskId());
                    continue;
                }
                if (record.status() == RecordStatus.RUNNING) {
                    handleRunning(record, inspection, orphans, samples, sampleFailures, overruns);
                } else if (inspection.liveness().isAlive()) {
                    handleZombie(record, zombies);
                }
            } catch (BackendException e) {
                log.warn("Could not act on {}: {}", record.taskId(), e.getMessage());
                unresolved.add(record.taskId());
            } finally {
                MdcContext.clearTask();
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        var report = new ReconciliationReport(orphans, zombies, samples, sampleFailures, overruns, unresolved,
                registry.stats(), Duration.ofMillis(elapsed));
        if (metrics != null) {
            metrics.recordSweep(elapsed, unresolved.size());
        }
        log.info("Sweep finished in {}ms: {} orphan(s), {} zombie(s), {} unresolved, {}",
                elapsed, orphans.size(), zombies.size(), unresolved.size(), report.stats());
        return report;
    }

    /**
     * Probes one record and samples it when it is a live RUNNING worker. Runs on the inspector pool.
     */
    public Inspection inspect(ProcessRecord record) {
        Liveness liveness = probe.probe(record.mode());
        if (record.status() != RecordStatus.RUNNING || !liveness.isAlive()) {
            return Inspection.unsampled(liveness);
        }
        try {
            return new Inspection(liveness, sample(record.mode()), null);
        } catch (BackendException e) {
            return new Inspection(liveness, null, e.getMessage());
        }
    }

    private Inspection inspectTracked(ProcessRecord record) {
        inspecting.add(record.taskId());
        try {
            return inspect(record);
        } finally {
            inspecting.remove(record.taskId());
        }
    }

    /**
     * Kills the worker behind a record and marks it FAILED with flag {@code killed}.
     * A record that is already terminal keeps its status and only gains the flag.
     *
     * <p>A native worker is only signalled while its fingerprint still matches. When the pid now
     * belongs to another process nothing is signalled and the record is flagged {@code pid-reused};
     * when it is gone the record is settled without signalling.
     *
     * @throws IllegalArgumentException if no record exists for {@code taskId}
     */
    public ProcessRecord kill(String taskId) {
        ProcessRecord record = registry.find(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Task " + taskId + " is not registered"));
        String flag = ProcessRecord.FLAG_KILLED;
        if (record.mode() instanceof ExecutionMode.Native) {
            Liveness liveness = probe.probe(record.mode());
            if (liveness == Liveness.ALIVE) {
                terminate(record.mode());
            } else if (liveness == Liveness.PID_REUSED) {
                log.warn("Not killing {}: pid {} now belongs to another process", taskId,
                        ((ExecutionMode.Native) record.mode()).pid());
                flag = ProcessRecord.FLAG_PID_REUSED;
            } else {
                log.info("Worker of {} already exited, nothing to signal", taskId);
            }
        } else {
            terminate(record.mode());
        }
        if (record.status() == RecordStatus.RUNNING) {
            return registry.markFailed(taskId, flag);
        }
        registry.flag(taskId, flag);
        return registry.find(taskId).orElse(record);
    }

    private Inspection await(ProcessRecord record, Future<Inspection> future, Instant deadlineBase) {
        // Inspections run concurrently, so each one is measured from the moment all were submitted.
        Duration remaining = settings.inspectionTimeout().minus(Duration.between(deadlineBase, Instant.now()));
        try {
            return future.get(Math.max(0, remaining.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Inspection of {} timed out after {}s, leaving it for the next sweep",
                    record.taskId(), settings.inspectionTimeout().toSeconds());
            return null;
        } catch (ExecutionException e) {
            log.warn("Inspection of {} failed: {}", record.taskId(), e.getCause().getMessage());
            return null;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private void handleRunning(ProcessRecord record, Inspection inspection, List<String> orphans,
                               Map<String, ResourceUsage> samples, List<String> sampleFailures,
                               List<String> overruns) {
        String taskId = record.taskId();
        if (!inspection.liveness().isAlive()) {
            boolean reused = inspection.liveness() == Liveness.PID_REUSED;
            String flag = reused ? ProcessRecord.FLAG_PID_REUSED : ProcessRecord.FLAG_ORPHAN;
            ProcessRecord updated = registry.markFailed(taskId, flag);
            if (updated.status() != RecordStatus.FAILED || !updated.flags().contains(flag)) {
                // Finished between the snapshot and now.
                log.debug("Task {} reached {} concurrently, not an orphan", taskId, updated.status());
                return;
            }
            orphans.add(taskId);
            overrunWarned.remove(taskId);
            log.warn("Orphan detected: {} ({}) is no longer alive, marked FAILED [{}]",
                    taskId, describe(record.mode()), flag);
            eventBus.publish(WaveforgeEvent.of(EventTypes.ORPHAN_DETECTED, WaveforgeEvent.WATCHDOG_SCOPE, taskId,
                    Map.of("reason", flag, "mode", record.mode().label(), "target", describe(record.mode()))));
            if (metrics != null) {
                metrics.recordOrphan(flag);
            }
            return;
        }

        if (inspection.sampleFailed()) {
            sampleFailures.add(taskId);
            log.warn("Could not sample {}: {}", taskId, inspection.sampleError());
            eventBus.publish(WaveforgeEvent.of(EventTypes.SAMPLE_FAILED, WaveforgeEvent.WATCHDOG_SCOPE, taskId,
                    Map.of("error", inspection.sampleError())));
        } else if (inspection.usage() != null) {
            samples.put(taskId, inspection.usage());
            log.debug("{}: cpu {}%, memory {}MB", taskId, inspection.usage().cpuPercent(),
                    inspection.usage().memoryMb());
        }

        Duration elapsed = record.elapsed(clock.instant());
        if (elapsed.compareTo(settings.overrunThreshold()) > 0) {
            overruns.add(taskId);
            if (overrunWarned.add(taskId)) {
                log.warn("Task {} has been running for {} minutes (threshold {})",
                        taskId, elapsed.toMinutes(), settings.overrunThreshold().toMinutes());
                eventBus.publish(WaveforgeEvent.of(EventTypes.TASK_OVERRUN, WaveforgeEvent.WATCHDOG_SCOPE, taskId,
                        Map.of("elapsedMinutes", elapsed.toMinutes(),
                                "thresholdMinutes", settings.overrunThreshold().toMinutes())));
            }
        }
    }

    private void handleZombie(ProcessRecord record, List<String> zombies) {
        String taskId = record.taskId();
        String target = describe(record.mode());
        log.warn("Zombie detected: {} is COMPLETED but {} is still alive, killing it", taskId, target);
        terminate(record.mode());
        registry.flag(taskId, ProcessRecord.FLAG_ZOMBIE_KILLED);
        zombies.add(taskId);
        log.info("Killed zombie {} ({})", taskId, target);
        eventBus.publish(WaveforgeEvent.of(EventTypes.ZOMBIE_DETECTED, WaveforgeEvent.WATCHDOG_SCOPE, taskId,
                Map.of("mode", record.mode().label(), "target", target)));
        if (metrics != null) {
            metrics.recordZombieKill(record.mode().label());
        }
    }

    private ResourceUsage sample(ExecutionMode mode) {
        if (mode instanceof ExecutionMode.Native nativeMode) {
            return processes.sample(nativeMode.pid());
        }
        return requireContainers().sample(((ExecutionMode.Container) mode).id());
    }

    private void terminate(ExecutionMode mode) {
        if (mode instanceof ExecutionMode.Native nativeMode) {
            processes.killGroup(nativeMode.pgid(), settings.killGrace());
        } else {
            requireContainers().kill(((ExecutionMode.Container) mode).id());
        }
    }

    private ContainerBackend requireContainers() {
        if (containers == null) {
            throw new BackendException("No container backend configured");
        }
        return containers;
    }

    private static String describe(ExecutionMode mode) {
        if (mode instanceof ExecutionMode.Native nativeMode) {
            return "process group " + nativeMode.pgid();
        }
        return "container " + ((ExecutionMode.Container) mode).shortId();
    }

    private void sweepSafely() {
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Watchdog sweep failed", e);
        }
    }
}
