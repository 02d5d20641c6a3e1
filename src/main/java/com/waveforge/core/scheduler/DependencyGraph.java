package com.waveforge.core.scheduler;

import com.waveforge.core.model.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges explicit ("after T###") and implicit (shared file lock) dependencies into one graph.
 *
 * <p>For every pair of tasks touching the same file, an edge runs from the task declared
 * earlier in the task list to the one declared later. Document order is the only tie-break.
 */
public final class DependencyGraph {

    private final List<Task> tasks;
    private final Map<String, Set<String>> edges;

    private DependencyGraph(List<Task> tasks, Map<String, Set<String>> edges) {
        this.tasks = tasks;
        this.edges = edges;
    }

    public static DependencyGraph build(List<Task> tasks) {
        var edges = new LinkedHashMap<String, Set<String>>();
        var fileOwners = new HashMap<String, List<String>>();

        for (var task : tasks) {
            var deps = new LinkedHashSet<>(task.dependencies());
            for (var file : task.fileLocks()) {
                var earlier = fileOwners.computeIfAbsent(file, f -> new ArrayList<>());
                for (var owner : earlier) {
                    if (!owner.equals(task.id())) {
                        deps.add(owner);
                    }
                }
                earlier.add(task.id());
            }
            edges.put(task.id(), Collections.unmodifiableSet(deps));
        }
        return new DependencyGraph(List.copyOf(tasks), Collections.unmodifiableMap(edges));
    }

    public Set<String> dependenciesOf(String taskId) {
        return edges.getOrDefault(taskId, Set.of());
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Returns the tasks in document order, each annotated with its merged dependencies.
     */
    public List<Task> resolve() {
        return tasks.stream()
                .map(t -> t.withDependencies(List.copyOf(dependenciesOf(t.id()))))
                .toList();
    }

    public List<Task> tasks() {
        return tasks;
    }
}
