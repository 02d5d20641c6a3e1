package com.waveforge.dispatch.cli;

import com.waveforge.backend.ResourceUsage;
import com.waveforge.collab.PolicyViolation;
import com.waveforge.core.engine.ExecutionReport;
import com.waveforge.core.engine.PolicyViolationException;
import com.waveforge.core.engine.WaveHaltException;
import com.waveforge.core.events.EventTypes;
import com.waveforge.core.events.WaveforgeEvent;
import com.waveforge.core.model.ExecutionPlan;
import com.waveforge.core.model.Task;
import com.waveforge.core.model.Wave;
import com.waveforge.core.scheduler.PlanningException;
import com.waveforge.registry.ProcessRecord;
import com.waveforge.registry.RegistryStats;
import com.waveforge.watchdog.ReconciliationReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import picocli.CommandLine;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Waveforge CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) WAVEFORGE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WAVEFORGE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void plan(ExecutionPlan plan) {
        info("Phase " + plan.phaseId() + ": " + plan.taskCount() + " task(s) in " + plan.waves().size() + " wave(s)");
        for (Wave wave : plan.waves()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold,fg(yellow) [WAVE " + wave.id() + "]|@ " + wave.strategy() + " - " + wave.rationale()));
            for (Task task : wave.tasks()) {
                String deps = task.dependencies().isEmpty() ? "" : " (after " + String.join(", ", task.dependencies()) + ")";
                System.out.println("  " + task.id() + " [" + task.role() + "] " + truncate(task.description(), 60) + deps);
            }
        }
    }

    public static void planningFailure(PlanningException e) {
        error("Planning failed: no wave can be formed");
        for (Map.Entry<String, List<String>> entry : e.stuckTasks().entrySet()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + entry.getKey() + " waiting on " + String.join(", ", entry.getValue())));
        }
    }

    public static void executionReport(ExecutionReport report) {
        for (ExecutionReport.WaveResult wave : report.waves()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) [WAVE " + wave.waveId() + " COMPLETE]|@ " +
                    "@|fg(green) " + wave.dispatched().size() + " dispatched|@" +
                    (wave.skipped().isEmpty() ? "" : ", " + wave.skipped().size() + " already done") +
                    (wave.committed() ? ", checkpoint committed" : "")));
        }
        success("Phase " + report.phaseId() + " complete: " + report.wavesCompleted() + " wave(s), "
                + report.tasksCompleted() + " task(s)");
    }

    public static void halt(WaveHaltException e) {
        error("Execution halted at wave " + e.waveId() + ": " + e.getMessage());
        if (!e.taskIds().isEmpty()) {
            error("Tasks: " + String.join(", ", e.taskIds()));
        }
        if (e instanceof PolicyViolationException policy) {
            for (PolicyViolation v : policy.violations()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + v));
            }
        }
    }

    public static void record(ProcessRecord record) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Task " + record.taskId() + "|@"));
        System.out.println("   Command: " + nullToDash(record.command()));
        System.out.println("   Mode:    " + record.mode().label() + " " + record.mode());
        System.out.println("   Status:  " + record.status());
        System.out.println("   Started: " + record.startedAt());
        if (record.finishedAt() != null) {
            System.out.println("   Ended:   " + record.finishedAt());
        }
        if (!record.rules().isEmpty()) {
            System.out.println("   Rules:   " + String.join(", ", record.rules()));
        }
        if (!record.flags().isEmpty()) {
            System.out.println("   Flags:   " + String.join(", ", record.flags()));
        }
    }

    public static void usage(ResourceUsage usage) {
        System.out.printf("   CPU:     %.1f%%%n", usage.cpuPercent());
        System.out.println("   Memory:  " + usage.memoryMb() + "MB");
    }

    public static void stats(RegistryStats stats) {
        System.out.println("   Running:   " + stats.running());
        System.out.println("   Completed: " + stats.completed());
        System.out.println("   Failed:    " + stats.failed());
        System.out.println("   Total:     " + stats.total());
    }

    public static void reconciliation(ReconciliationReport report) {
        if (!report.orphans().isEmpty()) {
            warn("Orphans marked FAILED (" + report.orphans().size() + "): " + String.join(", ", report.orphans()));
        }
        if (!report.zombies().isEmpty()) {
            warn("Zombies killed (" + report.zombies().size() + "): " + String.join(", ", report.zombies()));
        }
        if (!report.overruns().isEmpty()) {
            warn("Running past threshold: " + String.join(", ", report.overruns()));
        }
        if (!report.sampleFailures().isEmpty()) {
            warn("Could not sample: " + String.join(", ", report.sampleFailures()));
        }
        if (!report.unresolved().isEmpty()) {
            warn("Unresolved this sweep: " + String.join(", ", report.unresolved()));
        }
        if (!report.hasIssues()) {
            success("No issues found");
        }
        stats(report.stats());
    }

    /**
     * One line per event, as it happens. Watchdog findings are highlighted.
     */
    public static void event(WaveforgeEvent event) {
        String color = event.eventType().startsWith("watchdog.") || event.eventType().equals(EventTypes.RUN_HALTED)
                ? "yellow" : "cyan";
        StringBuilder line = new StringBuilder("@|fg(" + color + ") [" + event.eventType() + "]|@");
        if (event.taskId() != null) {
            line.append(' ').append(event.taskId());
        }
        new TreeMap<>(event.payload()).forEach((key, value) -> line.append(' ').append(key).append('=').append(value));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
    }

    /**
     * Summary of the {@code waveforge.*} meters recorded during this invocation.
     */
    public static void metrics(MeterRegistry registry) {
        List<Meter> meters = registry.getMeters().stream()
                .filter(m -> m.getId().getName().startsWith("waveforge."))
                .sorted(Comparator.comparing((Meter m) -> m.getId().getName())
                        .thenComparing(m -> m.getId().getTags().toString()))
                .toList();
        if (meters.isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Metrics|@"));
        for (Meter meter : meters) {
            String name = meter.getId().getName() + tags(meter.getId().getTags());
            if (meter instanceof Counter counter) {
                System.out.printf("   %-55s %.0f%n", name, counter.count());
            } else if (meter instanceof Timer timer) {
                System.out.printf("   %-55s count=%d total=%.0fms%n", name, timer.count(),
                        timer.totalTime(TimeUnit.MILLISECONDS));
            } else if (meter instanceof DistributionSummary summary) {
                System.out.printf("   %-55s count=%d mean=%.1f%n", name, summary.count(), summary.mean());
            }
        }
    }

    private static String tags(List<Tag> tags) {
        if (tags.isEmpty()) {
            return "";
        }
        return tags.stream().map(t -> t.getKey() + "=" + t.getValue()).collect(Collectors.joining(",", "{", "}"));
    }

    private static String nullToDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
