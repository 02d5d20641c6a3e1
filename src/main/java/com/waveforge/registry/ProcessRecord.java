package com.waveforge.registry;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Durable record of one spawned worker.
 *
 * @param taskId     namespaced task id, e.g. {@code waveforge:T001}
 * @param mode       native process group or container
 * @param status     current lifecycle status
 * @param startedAt  when the worker was registered
 * @param finishedAt when the record reached a terminal status; null while running
 * @param command    what was launched, for operators
 * @param rules      policy rule names carried over from the task
 * @param flags      watchdog annotations such as {@code orphan}, {@code pid-reused}, {@code zombie-killed}
 */
public record ProcessRecord(
    String taskId,
    ExecutionMode mode,
    RecordStatus status,
    Instant startedAt,
    Instant finishedAt,
    String command,
    List<String> rules,
    List<String> flags
) {

    public static final String FLAG_ORPHAN = "orphan";
    public static final String FLAG_PID_REUSED = "pid-reused";
    public static final String FLAG_ZOMBIE_KILLED = "zombie-killed";
    public static final String FLAG_KILLED = "killed";

    public ProcessRecord {
        rules = rules == null ? List.of() : List.copyOf(rules);
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static ProcessRecord running(String taskId, ExecutionMode mode, String command, List<String> rules,
                                        Instant now) {
        return new ProcessRecord(taskId, mode, RecordStatus.RUNNING, now, null, command, rules, List.of());
    }

    public ProcessRecord withStatus(RecordStatus newStatus, Instant at) {
        return new ProcessRecord(taskId, mode, newStatus, startedAt, newStatus.isTerminal() ? at : null,
                command, rules, flags);
    }

    public ProcessRecord withFlag(String flag) {
        if (flag == null || flags.contains(flag)) {
            return this;
        }
        var merged = new LinkedHashSet<>(flags);
        merged.add(flag);
        return new ProcessRecord(taskId, mode, status, startedAt, finishedAt, command, rules, List.copyOf(merged));
    }

    /** Running records measure up to {@code now}; terminal ones up to their finish time. */
    public Duration elapsed(Instant now) {
        Instant end = finishedAt != null ? finishedAt : now;
        Duration elapsed = Duration.between(startedAt, end);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
}
