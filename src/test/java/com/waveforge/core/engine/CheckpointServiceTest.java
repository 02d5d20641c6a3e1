package com.waveforge.core.engine;

import com.waveforge.collab.CompletionMarkerStore;
import com.waveforge.collab.PolicyValidator;
import com.waveforge.collab.PolicyViolation;
import com.waveforge.collab.VersionControl;
import com.waveforge.collab.VersionControlException;
import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.core.model.CheckpointPolicy;
import com.waveforge.core.model.Task;
import com.waveforge.core.model.Wave;
import com.waveforge.core.model.WaveStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link CheckpointService}.
 */
class CheckpointServiceTest {

    @TempDir
    Path dir;

    private CompletionMarkerStore markers;
    private PolicyValidator policyValidator;
    private VersionControl versionControl;
    private ProgressLog progressLog;
    private Runnable onVerified;
    private SimpleMeterRegistry meterRegistry;
    private CheckpointService service;

    private final Wave wave = new Wave(2, WaveStrategy.PARALLEL, List.of(
            new Task("T001", "Edit a.py", null, List.of("a.py"), List.of(), List.of(), false),
            new Task("T003", "Edit b.py", null, List.of("b.py", "a.py"), List.of(), List.of(), false)),
            "r", CheckpointPolicy.forWave(2));

    @BeforeEach
    void setUp() {
        markers = mock(CompletionMarkerStore.class);
        policyValidator = mock(PolicyValidator.class);
        versionControl = mock(VersionControl.class);
        onVerified = mock(Runnable.class);
        progressLog = new ProgressLog(dir.resolve("progress.md"),
                Clock.fixed(Instant.parse("2026-01-05T10:30:00Z"), ZoneOffset.UTC));
        meterRegistry = new SimpleMeterRegistry();
        service = new CheckpointService(markers, progressLog, policyValidator, versionControl,
                new WaveforgeMetrics(meterRegistry));
    }

    private double outcome(String name) {
        return meterRegistry.counter("waveforge.checkpoints.total", "outcome", name).count();
    }

    @Nested
    @DisplayName("successful checkpoint")
    class Success {

        @BeforeEach
        void allGreen() {
            when(markers.completedTaskIds(any())).thenReturn(Set.of("T001", "T003"));
            when(versionControl.changedFiles()).thenReturn(List.of("a.py", "b.py"));
            when(policyValidator.validate(anyList())).thenReturn(List.of());
            when(versionControl.commit(anyString())).thenReturn(true);
        }

        @Test
        @DisplayName("verifies, records progress, validates and commits in that order")
        void runsStepsInOrder() {
            assertTrue(service.checkpoint(wave, onVerified));

            InOrder order = inOrder(markers, onVerified, policyValidator, versionControl);
            order.verify(markers).completedTaskIds(wave.tasks());
            order.verify(onVerified).run();
            order.verify(versionControl).changedFiles();
            order.verify(policyValidator).validate(List.of("a.py", "b.py"));
            order.verify(versionControl).commit(CheckpointService.commitMessage(wave));
            assertEquals(1.0, outcome("committed"));
        }

        @Test
        @DisplayName("appends the wave to the progress log")
        void writesProgress() throws Exception {
            service.checkpoint(wave, onVerified);

            String progress = Files.readString(progressLog.file());
            assertTrue(progress.startsWith(ProgressLog.HEADER));
            assertTrue(progress.contains("## Wave 2 Complete - 2026-01-05 10:30:00"));
            assertTrue(progress.contains("- [x] T001: Edit a.py\n- [x] T003: Edit b.py\n"));
        }

        @Test
        @DisplayName("validates the wave's file locks when no change is reported")
        void fallsBackToLocks() {
            when(versionControl.changedFiles()).thenReturn(List.of());

            service.checkpoint(wave, onVerified);

            verify(policyValidator).validate(List.of("a.py", "b.py"));
        }

        @Test
        @DisplayName("nothing to commit is still a successful checkpoint")
        void nothingToCommit() {
            when(versionControl.commit(anyString())).thenReturn(false);

            assertFalse(service.checkpoint(wave, onVerified));
            assertEquals(1.0, outcome("committed"));
        }

        @Test
        @DisplayName("formats the commit message with every task id")
        void commitMessage() {
            assertEquals("[CHECKPOINT] Wave 2 Complete\n\nAll tasks verified and validated\n\nTasks: T001, T003",
                    CheckpointService.commitMessage(wave));
        }
    }

    @Nested
    @DisplayName("halting")
    class Halting {

        @Test
        @DisplayName("an unverified task halts before anything is written")
        void verificationFails() {
            when(markers.completedTaskIds(any())).thenReturn(Set.of("T001"));

            var ex = assertThrows(VerificationException.class, () -> service.checkpoint(wave, onVerified));

            assertEquals(2, ex.waveId());
            assertEquals(List.of("T003"), ex.missingTaskIds());
            verifyNoInteractions(onVerified, policyValidator, versionControl);
            assertFalse(Files.exists(progressLog.file()));
            assertEquals(1.0, outcome("verification_failed"));
        }

        @Test
        @DisplayName("a policy violation halts without committing")
        void policyBlocks() {
            when(markers.completedTaskIds(any())).thenReturn(Set.of("T001", "T003"));
            when(versionControl.changedFiles()).thenReturn(List.of("a.py"));
            var violation = new PolicyViolation("a.py", 3, "no-secrets", "token");
            when(policyValidator.validate(anyList())).thenReturn(List.of(violation));

            var ex = assertThrows(PolicyViolationException.class, () -> service.checkpoint(wave, onVerified));

            assertEquals(List.of(violation), ex.violations());
            assertEquals(List.of("T001", "T003"), ex.taskIds());
            verify(versionControl, never()).commit(anyString());
            assertEquals(1.0, outcome("policy_blocked"));
        }

        @Test
        @DisplayName("a failing commit halts with the commit step")
        void commitFails() {
            when(markers.completedTaskIds(any())).thenReturn(Set.of("T001", "T003"));
            when(versionControl.changedFiles()).thenReturn(List.of("a.py"));
            when(policyValidator.validate(anyList())).thenReturn(List.of());
            when(versionControl.commit(anyString())).thenThrow(new VersionControlException("index.lock exists"));

            var ex = assertThrows(CheckpointException.class, () -> service.checkpoint(wave, onVerified));

            assertEquals(CheckpointException.STEP_COMMIT, ex.step());
            assertInstanceOf(VersionControlException.class, ex.getCause());
            assertEquals(1.0, outcome("io_failed"));
        }

        @Test
        @DisplayName("an unwritable progress log halts with the progress step")
        void progressFails() throws Exception {
            when(markers.completedTaskIds(any())).thenReturn(Set.of("T001", "T003"));
            Files.createDirectories(progressLog.file());

            var ex = assertThrows(CheckpointException.class, () -> service.checkpoint(wave, onVerified));

            assertEquals(CheckpointException.STEP_PROGRESS, ex.step());
            verifyNoInteractions(policyValidator);
        }
    }
}
