package com.waveforge.collab;

import com.waveforge.core.model.Task;
import com.waveforge.registry.ExecutionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Spawns nothing: announces each task and its completion handshake, and leaves the work to
 * agents driven from outside. The executor then only waits for completion markers.
 */
public class HandshakeTaskDispatcher implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(HandshakeTaskDispatcher.class);

    @Override
    public Optional<ExecutionMode> dispatch(Task task) {
        log.info("Agent {}: {} - {}", task.role(), task.id(), abbreviate(task.description()));
        log.info("{}: {}", task.id(), task.completionHandshake());
        return Optional.empty();
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 57) + "...";
    }
}
