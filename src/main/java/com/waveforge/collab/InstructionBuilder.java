package com.waveforge.collab;

import com.waveforge.core.model.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the instruction a worker receives, and expands dispatch command templates.
 * Pure functions.
 */
public final class InstructionBuilder {

    private InstructionBuilder() {}

    public static String build(Task task) {
        var sb = new StringBuilder();
        sb.append("# Task: ").append(task.id()).append("\n\n");
        sb.append("Role: ").append(task.role()).append("\n\n");

        sb.append("## Objective\n\n");
        sb.append(task.description()).append("\n\n");

        if (!task.fileLocks().isEmpty()) {
            sb.append("## Files\n\n");
            sb.append("Only this task may modify these files during its wave:\n");
            task.fileLocks().forEach(f -> sb.append("- ").append(f).append('\n'));
            sb.append('\n');
        }

        if (!task.rules().isEmpty()) {
            sb.append("## Rules\n\n");
            task.rules().forEach(r -> sb.append("- ").append(r).append('\n'));
            sb.append('\n');
        }

        sb.append("## Completion\n\n");
        sb.append(task.completionHandshake()).append('\n');
        return sb.toString();
    }

    /**
     * Splits {@code template} on whitespace, then substitutes {@code {taskId}} and {@code {instruction}}
     * inside each token, so a multi-line instruction stays a single argument.
     */
    public static List<String> expand(String template, Task task) {
        var values = Map.of("{taskId}", task.id(), "{instruction}", build(task));
        var argv = new ArrayList<String>();
        for (String token : template.strip().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            String expanded = token;
            for (var entry : values.entrySet()) {
                expanded = expanded.replace(entry.getKey(), entry.getValue());
            }
            argv.add(expanded);
        }
        return argv;
    }
}
