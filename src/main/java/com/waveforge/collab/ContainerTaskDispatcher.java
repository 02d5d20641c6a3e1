package com.waveforge.collab;

import com.waveforge.backend.ContainerBackend;
import com.waveforge.backend.ContainerSpec;
import com.waveforge.core.model.Task;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.ResourceLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs each task in its own container with the working tree mounted at {@code /workspace}.
 */
public class ContainerTaskDispatcher implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ContainerTaskDispatcher.class);

    private final ContainerBackend backend;
    private final String image;
    private final String commandTemplate;
    private final Path workDir;
    private final ResourceLimits limits;

    public ContainerTaskDispatcher(ContainerBackend backend, String image, String commandTemplate, Path workDir,
                                   ResourceLimits limits) {
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("Container dispatch requires waveforge.dispatch.image");
        }
        this.backend = backend;
        this.image = image;
        this.commandTemplate = commandTemplate;
        this.workDir = workDir;
        this.limits = limits;
    }

    @Override
    public Optional<ExecutionMode> dispatch(Task task) {
        List<String> command = commandTemplate == null || commandTemplate.isBlank()
                ? List.of()
                : InstructionBuilder.expand(commandTemplate, task);
        var env = Map.of(
                "WAVEFORGE_TASK_ID", task.id(),
                "WAVEFORGE_ROLE", task.role(),
                "WAVEFORGE_INSTRUCTION", InstructionBuilder.build(task));
        ExecutionMode.Container mode = backend.run(new ContainerSpec(task.id(), image, command, workDir, env, limits));
        log.info("Dispatched {} to container {} (role {})", task.id(), mode.shortId(), task.role());
        return Optional.of(mode);
    }
}
