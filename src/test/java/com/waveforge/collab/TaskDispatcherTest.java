package com.waveforge.collab;

import com.waveforge.backend.ContainerBackend;
import com.waveforge.backend.ContainerSpec;
import com.waveforge.backend.ProcessBackend;
import com.waveforge.core.model.Task;
import com.waveforge.registry.ExecutionMode;
import com.waveforge.registry.ResourceLimits;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the handshake, native and container {@link TaskDispatcher}s.
 */
class TaskDispatcherTest {

    private static final Path WORK_DIR = Path.of("/tmp/project");
    private final Task task = new Task("T002", "Add endpoint in api.py", "Backend", List.of("api.py"),
            List.of(), List.of(), false);

    @Nested
    @DisplayName("handshake")
    class Handshake {

        @Test
        @DisplayName("spawns nothing")
        void spawnsNothing() {
            assertTrue(new HandshakeTaskDispatcher().dispatch(task).isEmpty());
        }
    }

    @Nested
    @DisplayName("native")
    class NativeDispatch {

        @Test
        @DisplayName("launches the expanded template with a per-task log file")
        void launches() {
            var backend = mock(ProcessBackend.class);
            var mode = new ExecutionMode.Native(500, 500, "s");
            when(backend.launch(any(), any(), any())).thenReturn(mode);
            var dispatcher = new NativeTaskDispatcher(backend, "agent --task {taskId}", WORK_DIR,
                    Path.of("/tmp/logs"));

            var result = dispatcher.dispatch(task);

            assertEquals(mode, result.orElseThrow());
            verify(backend).launch(List.of("agent", "--task", "T002"), WORK_DIR, Path.of("/tmp/logs/T002.log"));
        }

        @Test
        @DisplayName("requires a command template")
        void requiresTemplate() {
            assertThrows(IllegalArgumentException.class,
                    () -> new NativeTaskDispatcher(mock(ProcessBackend.class), " ", WORK_DIR, WORK_DIR));
        }
    }

    @Nested
    @DisplayName("container")
    class ContainerDispatch {

        @Test
        @DisplayName("runs the image with the task environment and limits")
        void runsImage() {
            var backend = mock(ContainerBackend.class);
            var limits = new ResourceLimits("2g", "2.0");
            var mode = new ExecutionMode.Container("abcdef0123456789", "waveforge-t002", limits);
            when(backend.run(any())).thenReturn(mode);
            var dispatcher = new ContainerTaskDispatcher(backend, "agent:1", "", WORK_DIR, limits);

            assertEquals(mode, dispatcher.dispatch(task).orElseThrow());

            var spec = ArgumentCaptor.forClass(ContainerSpec.class);
            verify(backend).run(spec.capture());
            assertEquals("agent:1", spec.getValue().image());
            assertTrue(spec.getValue().command().isEmpty());
            assertEquals("T002", spec.getValue().env().get("WAVEFORGE_TASK_ID"));
            assertEquals("Backend", spec.getValue().env().get("WAVEFORGE_ROLE"));
            assertTrue(spec.getValue().env().get("WAVEFORGE_INSTRUCTION").contains("Add endpoint in api.py"));
            assertEquals(limits, spec.getValue().limits());
        }

        @Test
        @DisplayName("requires an image")
        void requiresImage() {
            assertThrows(IllegalArgumentException.class, () -> new ContainerTaskDispatcher(
                    mock(ContainerBackend.class), "", "", WORK_DIR, ResourceLimits.defaults()));
        }
    }
}
