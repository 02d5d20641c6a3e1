package com.waveforge.core.scheduler;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when no remaining task can be placed in a wave: a dependency cycle, a dependency on an
 * unknown task, or a lock deadlock. No partial plan accompanies it.
 */
public class PlanningException extends RuntimeException {

    private final Map<String, List<String>> stuckTasks;

    /**
     * @param stuckTasks every unassigned task ID mapped to the dependencies it still waits on
     */
    public PlanningException(Map<String, List<String>> stuckTasks) {
        super(describe(stuckTasks));
        this.stuckTasks = Map.copyOf(stuckTasks);
    }

    public List<String> stuckTaskIds() {
        return stuckTasks.keySet().stream().sorted().toList();
    }

    public Map<String, List<String>> stuckTasks() {
        return stuckTasks;
    }

    private static String describe(Map<String, List<String>> stuckTasks) {
        return "Circular dependency or unresolvable conflict: no wave can be formed for "
                + stuckTasks.entrySet().stream()
                        .sorted(Map.Entry.comparingByKey())
                        .map(e -> e.getKey() + " (waiting on " + String.join(", ", e.getValue()) + ")")
                        .collect(Collectors.joining(", "));
    }
}
