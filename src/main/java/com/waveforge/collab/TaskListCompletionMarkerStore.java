package com.waveforge.collab;

import com.waveforge.core.model.Task;
import com.waveforge.core.parser.TaskParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads completion markers from the task list itself: workers flip {@code - [ ]} to {@code - [x]}.
 *
 * <p>Tasks are matched by description rather than id, since ids are positional and the file may
 * have been edited since planning. A task whose description no longer appears counts as incomplete.
 */
public class TaskListCompletionMarkerStore implements CompletionMarkerStore {

    private static final Logger log = LoggerFactory.getLogger(TaskListCompletionMarkerStore.class);

    private final Path tasksFile;
    private final TaskParser parser;

    public TaskListCompletionMarkerStore(Path tasksFile, TaskParser parser) {
        this.tasksFile = tasksFile;
        this.parser = parser;
    }

    /**
     * @throws com.waveforge.core.parser.TaskListException if the task list cannot be read
     */
    @Override
    public Set<String> completedTaskIds(Collection<Task> tasks) {
        Map<String, Boolean> byDescription = new HashMap<>();
        for (Task parsed : parser.parse(tasksFile)) {
            byDescription.merge(parsed.description(), parsed.completed(), Boolean::logicalAnd);
        }

        var completed = new LinkedHashSet<String>();
        for (Task task : tasks) {
            Boolean done = byDescription.get(task.description());
            if (done == null) {
                log.warn("{}: task not found in {}", task.id(), tasksFile);
            } else if (done) {
                completed.add(task.id());
            }
        }
        return completed;
    }
}
