package com.waveforge.collab;

import com.waveforge.backend.ProcessBackend;
import com.waveforge.core.model.Task;
import com.waveforge.registry.ExecutionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Launches each task as a local process group from a command template.
 * Output goes to {@code <logDir>/<taskId>.log}.
 */
public class NativeTaskDispatcher implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NativeTaskDispatcher.class);

    private final ProcessBackend backend;
    private final String commandTemplate;
    private final Path workDir;
    private final Path logDir;

    public NativeTaskDispatcher(ProcessBackend backend, String commandTemplate, Path workDir, Path logDir) {
        if (commandTemplate == null || commandTemplate.isBlank()) {
            throw new IllegalArgumentException("Native dispatch requires waveforge.dispatch.command");
        }
        this.backend = backend;
        this.commandTemplate = commandTemplate;
        this.workDir = workDir;
        this.logDir = logDir;
    }

    @Override
    public Optional<ExecutionMode> dispatch(Task task) {
        List<String> argv = InstructionBuilder.expand(commandTemplate, task);
        Path logFile = logDir.resolve(task.id() + ".log");
        ExecutionMode.Native mode = backend.launch(argv, workDir, logFile);
        log.info("Dispatched {} as pid {} (role {})", task.id(), mode.pid(), task.role());
        return Optional.of(mode);
    }
}
