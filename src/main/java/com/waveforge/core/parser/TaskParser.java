package com.waveforge.core.parser;

import com.waveforge.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a markdown task list into {@link Task} records.
 *
 * <p>Grammar:
 * <ul>
 *   <li>{@code - [ ] text} or {@code - [x] text} starts a task; {@code [x]} marks it completed</li>
 *   <li>an indented {@code - **Constitution**: a, b} line attaches policy rules to the current task</li>
 *   <li>an indented {@code - **Role**: Name} line sets the agent role</li>
 *   <li>a blank line ends the current task block; other lines are ignored</li>
 * </ul>
 *
 * <p>File locks come from backtick-wrapped paths and bare path tokens in the description.
 * Explicit dependencies come from "after T###" and "depends on T###"; any other phrasing is ignored.
 */
@Component
public class TaskParser {

    private static final Logger log = LoggerFactory.getLogger(TaskParser.class);

    static final String OPEN_PREFIX = "- [ ]";
    static final String DONE_PREFIX = "- [x]";

    private static final Pattern BACKTICK_PATH = Pattern.compile("`([^`]+\\.[a-zA-Z]+)`");
    private static final Pattern BARE_PATH = Pattern.compile("\\b([\\w/.-]+\\.[a-zA-Z]{2,4})\\b");
    private static final Pattern DEPENDENCY = Pattern.compile(
            "\\b(?:after|depends on)\\s+T(\\d{3})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RULES_LINE = Pattern.compile("^\\s*- \\*\\*Constitution\\*\\*:\\s*(.+)$");
    private static final Pattern ROLE_LINE = Pattern.compile("^\\s*- \\*\\*Role\\*\\*:\\s*(.+)$");

    /**
     * Reads and parses a task list file.
     *
     * @throws TaskListException if the file is missing or unreadable
     */
    public List<Task> parse(Path tasksFile) {
        if (!Files.exists(tasksFile)) {
            throw new TaskListException("Task list not found: " + tasksFile);
        }
        String content;
        try {
            content = Files.readString(tasksFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TaskListException("Failed to read task list " + tasksFile, e);
        }
        var tasks = parse(content);
        log.info("Parsed {} tasks from {}", tasks.size(), tasksFile);
        return tasks;
    }

    public List<Task> parse(String content) {
        var tasks = new ArrayList<Task>();
        var block = new ArrayList<String>();

        for (String line : content.split("\n", -1)) {
            line = stripCarriageReturn(line);
            if (line.startsWith(OPEN_PREFIX) || line.startsWith(DONE_PREFIX)) {
                if (!block.isEmpty()) {
                    tasks.add(toTask(block, tasks.size() + 1));
                }
                block = new ArrayList<>();
                block.add(line);
            } else if (!block.isEmpty() && (RULES_LINE.matcher(line).matches() || ROLE_LINE.matcher(line).matches())) {
                block.add(line);
            } else if (line.isBlank() && !block.isEmpty()) {
                tasks.add(toTask(block, tasks.size() + 1));
                block = new ArrayList<>();
            }
        }
        if (!block.isEmpty()) {
            tasks.add(toTask(block, tasks.size() + 1));
        }
        return tasks;
    }

    private Task toTask(List<String> block, int ordinal) {
        String first = block.get(0);
        boolean completed = first.startsWith(DONE_PREFIX);
        String description = first.substring(first.indexOf(']') + 1).trim();

        var rules = new ArrayList<String>();
        String role = null;
        for (String line : block.subList(1, block.size())) {
            Matcher rulesMatch = RULES_LINE.matcher(line);
            if (rulesMatch.matches()) {
                for (String rule : rulesMatch.group(1).split(",")) {
                    if (!rule.isBlank()) {
                        rules.add(rule.trim());
                    }
                }
                continue;
            }
            Matcher roleMatch = ROLE_LINE.matcher(line);
            if (roleMatch.matches()) {
                role = roleMatch.group(1).trim();
            }
        }

        var task = new Task(taskId(ordinal), description, role,
                extractFileReferences(description), extractDependencies(description), rules, completed);
        log.debug("  {} locks={} deps={} rules={}", task.id(), task.fileLocks(), task.dependencies(), task.rules());
        return task;
    }

    public static String taskId(int ordinal) {
        return "T%03d".formatted(ordinal);
    }

    /**
     * Extracts file paths from backtick-wrapped and bare path tokens, deduplicated in first-seen order.
     */
    static List<String> extractFileReferences(String description) {
        var files = new LinkedHashSet<String>();
        Matcher backtick = BACKTICK_PATH.matcher(description);
        while (backtick.find()) {
            files.add(backtick.group(1));
        }
        Matcher bare = BARE_PATH.matcher(description);
        while (bare.find()) {
            files.add(bare.group(1));
        }
        return List.copyOf(files);
    }

    static List<String> extractDependencies(String description) {
        var deps = new LinkedHashSet<String>();
        Matcher matcher = DEPENDENCY.matcher(description);
        while (matcher.find()) {
            deps.add("T" + matcher.group(1));
        }
        return List.copyOf(deps);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
