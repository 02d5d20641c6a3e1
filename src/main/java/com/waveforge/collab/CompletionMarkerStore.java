package com.waveforge.collab;

import com.waveforge.core.model.Task;

import java.util.Collection;
import java.util.Set;

/**
 * Source of truth for which tasks a worker has reported as done. Read-only from the scheduler's side.
 */
public interface CompletionMarkerStore {

    /**
     * @return ids of those {@code tasks} currently marked complete
     */
    Set<String> completedTaskIds(Collection<Task> tasks);
}
