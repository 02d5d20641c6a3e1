package com.waveforge.watchdog;

import com.waveforge.registry.RecordStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Registry digest for a session that lost its in-memory context: every record grouped by status,
 * with elapsed time. Built from disk only; says nothing about whether workers are still alive.
 */
public record RehydrationReport(
    Path registryPath,
    Instant generatedAt,
    List<Entry> running,
    List<Entry> completed,
    List<Entry> failed
) {

    /**
     * @param target  pid/pgid or container id
     * @param elapsed now minus start for running records, finish minus start otherwise
     */
    public record Entry(String taskId, RecordStatus status, String mode, String target, String command,
                        Instant startedAt, Duration elapsed, List<String> flags) {}

    public RehydrationReport {
        running = List.copyOf(running);
        completed = List.copyOf(completed);
        failed = List.copyOf(failed);
    }

    public int total() {
        return running.size() + completed.size() + failed.size();
    }

    public String render() {
        var sb = new StringBuilder();
        sb.append("Context Re-Hydration Report\n");
        sb.append("===========================\n\n");

        if (running.isEmpty()) {
            sb.append("No tasks currently running\n\n");
        } else {
            section(sb, "ACTIVE TASKS", running);
        }
        if (!failed.isEmpty()) {
            section(sb, "FAILED TASKS", failed);
        }
        if (!completed.isEmpty()) {
            section(sb, "COMPLETED TASKS", completed);
        }

        sb.append("SUMMARY:\n");
        sb.append("   Running:   ").append(running.size()).append('\n');
        sb.append("   Completed: ").append(completed.size()).append('\n');
        sb.append("   Failed:    ").append(failed.size()).append('\n');
        sb.append("   Total:     ").append(total()).append('\n');
        sb.append("\nFull context: ").append(registryPath).append('\n');
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, List<Entry> entries) {
        sb.append(title).append(" (").append(entries.size()).append(")\n\n");
        for (Entry entry : entries) {
            sb.append("Task ").append(entry.taskId()).append('\n');
            if (entry.command() != null && !entry.command().isBlank()) {
                sb.append("  Command: ").append(entry.command()).append('\n');
            }
            sb.append("  Mode:    ").append(entry.mode()).append(" (").append(entry.target()).append(")\n");
            sb.append("  Started: ").append(entry.startedAt()).append('\n');
            sb.append("  Elapsed: ").append(formatDuration(entry.elapsed())).append('\n');
            if (!entry.flags().isEmpty()) {
                sb.append("  Flags:   ").append(String.join(", ", entry.flags())).append('\n');
            }
            sb.append('\n');
        }
    }

    static String formatDuration(Duration duration) {
        long hours = duration.toHours();
        int minutes = duration.toMinutesPart();
        int seconds = duration.toSecondsPart();
        if (hours > 0) {
            return String.format("%dh %02dm %02ds", hours, minutes, seconds);
        }
        if (minutes > 0) {
            return String.format("%dm %02ds", minutes, seconds);
        }
        return seconds + "s";
    }
}
