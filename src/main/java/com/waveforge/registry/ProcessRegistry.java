package com.waveforge.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable registry of spawned workers.
 *
 * <p>Every mutation goes through {@link RegistryStore#update}, so in-memory state never outlives
 * the on-disk copy. Status moves only from RUNNING to COMPLETED or FAILED.
 */
public class ProcessRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    private final RegistryStore store;
    private final Clock clock;

    public ProcessRegistry(RegistryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public ProcessRegistry(RegistryStore store) {
        this(store, Clock.systemUTC());
    }

    public RegistryStore store() {
        return store;
    }

    /**
     * Registers a RUNNING worker. Re-registering an existing id replaces the previous record.
     */
    public ProcessRecord register(String taskId, ExecutionMode mode, String command, List<String> rules) {
        var record = ProcessRecord.running(taskId, mode, command, rules, clock.instant());
        store.update(doc -> {
            if (doc.tasks().containsKey(taskId)) {
                log.warn("Task {} already registered ({}), overwriting", taskId, doc.tasks().get(taskId).status());
            }
            return doc.with(record);
        });
        log.info("Registered {} as {} {}", taskId, mode.label(), mode);
        return record;
    }

    public ProcessRecord markCompleted(String taskId) {
        return transition(taskId, RecordStatus.COMPLETED, null);
    }

    public ProcessRecord markFailed(String taskId, String flag) {
        return transition(taskId, RecordStatus.FAILED, flag);
    }

    /**
     * Moves a RUNNING record to a terminal status. A record that is already terminal is returned unchanged.
     *
     * @throws IllegalArgumentException if no record exists for {@code taskId}
     */
    private ProcessRecord transition(String taskId, RecordStatus target, String flag) {
        Instant now = clock.instant();
        var doc = store.update(current -> {
            ProcessRecord record = current.tasks().get(taskId);
            if (record == null) {
                throw new IllegalArgumentException("Task " + taskId + " is not registered");
            }
            if (record.status().isTerminal()) {
                log.debug("Task {} already {}, ignoring transition to {}", taskId, record.status(), target);
                return current;
            }
            return current.with(record.withStatus(target, now).withFlag(flag));
        });
        ProcessRecord result = doc.tasks().get(taskId);
        log.info("Task {} is {}", taskId, result.status());
        return result;
    }

    /**
     * Adds an annotation to a record without changing its status.
     */
    public void flag(String taskId, String flag) {
        store.update(current -> {
            ProcessRecord record = current.tasks().get(taskId);
            return record == null ? current : current.with(record.withFlag(flag));
        });
    }

    public Optional<ProcessRecord> find(String taskId) {
        return Optional.ofNullable(store.load().tasks().get(taskId));
    }

    public RegistryDocument snapshot() {
        return store.load();
    }

    public RegistryStats stats() {
        return RegistryStats.of(store.load());
    }

    public boolean remove(String taskId) {
        boolean[] removed = {false};
        store.update(current -> {
            removed[0] = current.tasks().containsKey(taskId);
            return current.without(taskId);
        });
        return removed[0];
    }

    /**
     * Removes terminal records that finished before {@code now - olderThan}. Operator-triggered only.
     *
     * @return number of removed records
     */
    public int cleanup(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        var removed = new ArrayList<String>();
        store.update(current -> {
            var next = current;
            for (ProcessRecord record : current.tasks().values()) {
                if (record.status().isTerminal() && record.finishedAt() != null && record.finishedAt().isBefore(cutoff)) {
                    removed.add(record.taskId());
                    next = next.without(record.taskId());
                }
            }
            return next;
        });
        log.info("Removed {} terminal records finished before {}: {}", removed.size(), cutoff, removed);
        return removed.size();
    }
}
