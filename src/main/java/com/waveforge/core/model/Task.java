package com.waveforge.core.model;

import java.util.List;

/**
 * A single unit of work parsed from the task list, executed by an agent in its own process or container.
 *
 * @param id           stable, order-preserving identifier (e.g., "T001")
 * @param description  the task line text after the checkbox
 * @param role         agent role tag (defaults to "Developer")
 * @param fileLocks    files this task declares it will modify, deduplicated in first-seen order
 * @param dependencies IDs of tasks that must be assigned to an earlier wave; explicit only after parsing,
 *                     explicit + implicit once resolved by the dependency graph
 * @param rules        policy rule names attached through a {@code - **Constitution**:} line
 * @param completed    whether the task list marks the task {@code [x]}
 */
public record Task(
    String id,
    String description,
    String role,
    List<String> fileLocks,
    List<String> dependencies,
    List<String> rules,
    boolean completed
) {

    public static final String DEFAULT_ROLE = "Developer";

    public Task {
        fileLocks = fileLocks == null ? List.of() : List.copyOf(fileLocks);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        rules = rules == null ? List.of() : List.copyOf(rules);
        role = role == null || role.isBlank() ? DEFAULT_ROLE : role;
    }

    /** Completion is the only mutable attribute; it is refreshed from the completion-marker source. */
    public Task withCompleted(boolean completed) {
        return new Task(id, description, role, fileLocks, dependencies, rules, completed);
    }

    /** Instruction handed to the worker telling it how to report completion. */
    public String completionHandshake() {
        return "Upon success, update tasks.md line containing '" + description + "' to [x]";
    }

    public Task withDependencies(List<String> dependencies) {
        return new Task(id, description, role, fileLocks, dependencies, rules, completed);
    }
}
