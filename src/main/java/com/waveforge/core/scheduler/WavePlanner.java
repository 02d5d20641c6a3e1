package com.waveforge.core.scheduler;

import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.core.model.CheckpointPolicy;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.model.Task;
import com.waveforge.core.model.Wave;
import com.waveforge.core.model.WaveStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Partitions tasks into ordered waves with a greedy pass per wave.
 *
 * <p>Each pass scans the unassigned tasks in document order. A task joins the current wave when
 * every dependency sits in an earlier wave and none of its file locks is already claimed by a task
 * placed in this wave. All eligible tasks of a pass go into the same wave. The result is
 * deterministic for a fixed task list, but not minimal in wave count; wave numbering must not change.
 */
@Service
public class WavePlanner {

    private static final Logger log = LoggerFactory.getLogger(WavePlanner.class);

    private final WaveforgeMetrics metrics;

    @Autowired
    public WavePlanner(WaveforgeMetrics metrics) {
        this.metrics = metrics;
    }

    public WavePlanner() {
        this(null);
    }

    /**
     * Builds the dependency graph for the given tasks and partitions them into waves.
     *
     * @param tasks   tasks in document order
     * @param phaseId phase identifier stored in the plan
     * @throws PlanningException if a pass places no task while tasks remain unassigned
     */
    public ExecutionPlan plan(List<Task> tasks, String phaseId) {
        long start = System.currentTimeMillis();
        var graph = DependencyGraph.build(tasks);
        log.info("Planning {} tasks with {} dependencies for phase {}", tasks.size(), graph.edgeCount(), phaseId);

        var waves = partition(graph.resolve());

        if (metrics != null) {
            metrics.recordPlanningDuration(System.currentTimeMillis() - start);
        }
        log.info("Organized {} tasks into {} waves", tasks.size(), waves.size());
        return new ExecutionPlan(phaseId, waves);
    }

    /**
     * @param tasks tasks whose {@link Task#dependencies()} already hold the merged dependency set
     */
    List<Wave> partition(List<Task> tasks) {
        var assigned = new HashSet<String>();
        var waves = new ArrayList<Wave>();
        int waveId = 1;

        while (assigned.size() < tasks.size()) {
            var members = new ArrayList<Task>();
            var claimedLocks = new HashSet<String>();

            for (var task : tasks) {
                if (assigned.contains(task.id())) {
                    continue;
                }
                if (!assigned.containsAll(task.dependencies())) {
                    log.debug("  {} - deps unsatisfied: {}", task.id(), task.dependencies());
                    continue;
                }
                if (hasLockConflict(task, claimedLocks)) {
                    log.debug("  {} - file lock conflict with wave {}, deferring (locks: {})",
                            task.id(), waveId, task.fileLocks());
                    if (metrics != null) {
                        metrics.recordFileLockDeferral();
                    }
                    continue;
                }
                members.add(task);
                claimedLocks.addAll(task.fileLocks());
            }

            if (members.isEmpty()) {
                throw new PlanningException(stuckTasks(tasks, assigned));
            }

            // Commit after the pass so that a dependency placed in this wave never satisfies another member.
            members.forEach(t -> assigned.add(t.id()));

            var wave = new Wave(waveId, WaveStrategy.forSize(members.size()), members,
                    "Wave %d: %d independent task(s) with no file conflicts".formatted(waveId, members.size()),
                    CheckpointPolicy.forWave(waveId));
            log.info("Wave {} ({}): {}", waveId, wave.strategy(), wave.taskIds());
            waves.add(wave);
            waveId++;
        }
        return waves;
    }

    private static boolean hasLockConflict(Task task, Set<String> claimedLocks) {
        for (var lock : task.fileLocks()) {
            if (claimedLocks.contains(lock)) {
                return true;
            }
        }
        return false;
    }

    private static LinkedHashMap<String, List<String>> stuckTasks(List<Task> tasks, Set<String> assigned) {
        var stuck = new LinkedHashMap<String, List<String>>();
        for (var task : tasks) {
            if (!assigned.contains(task.id())) {
                stuck.put(task.id(), task.dependencies().stream()
                        .filter(d -> !assigned.contains(d))
                        .toList());
            }
        }
        log.error("No eligible task among {} unassigned: {}", stuck.size(), stuck);
        return stuck;
    }
}
