package com.waveforge.core.engine;

import com.waveforge.collab.CompletionMarkerStore;
import com.waveforge.collab.PolicyValidator;
import com.waveforge.collab.PolicyViolation;
import com.waveforge.collab.VersionControl;
import com.waveforge.collab.VersionControlException;
import com.waveforge.core.metrics.WaveforgeMetrics;
import com.waveforge.core.model.Wave;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Closes a wave with four steps, in order, each of which halts the run on failure:
 * <ol>
 *   <li>re-verify every wave task is marked complete</li>
 *   <li>append the wave to the progress log</li>
 *   <li>validate the changed files against project policy</li>
 *   <li>commit once</li>
 * </ol>
 */
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    private final CompletionMarkerStore markers;
    private final ProgressLog progressLog;
    private final PolicyValidator policyValidator;
    private final VersionControl versionControl;
    private final WaveforgeMetrics metrics;

    public CheckpointService(CompletionMarkerStore markers, ProgressLog progressLog, PolicyValidator policyValidator,
                             VersionControl versionControl, WaveforgeMetrics metrics) {
        this.markers = markers;
        this.progressLog = progressLog;
        this.policyValidator = policyValidator;
        this.versionControl = versionControl;
        this.metrics = metrics;
    }

    /**
     * @param onVerified runs right after step 1 passes
     * @return true when a commit was created, false when there was nothing to commit
     */
    public boolean checkpoint(Wave wave, Runnable onVerified) {
        int waveId = wave.id();
        log.info("Checkpoint after wave {}", waveId);

        verify(wave);
        onVerified.run();

        try {
            progressLog.appendWave(wave);
        } catch (IOException e) {
            record("io_failed");
            throw new CheckpointException(waveId, CheckpointException.STEP_PROGRESS, wave.taskIds(),
                    "Failed to update " + progressLog.file() + ": " + e.getMessage(), e);
        }
        log.info("Wave {} recorded in {}", waveId, progressLog.file());

        List<String> files = changedFiles(wave);
        List<PolicyViolation> violations = policyValidator.validate(files);
        if (!violations.isEmpty()) {
            violations.forEach(v -> log.error("Policy violation: {}", v));
            record("policy_blocked");
            throw new PolicyViolationException(waveId, wave.taskIds(), violations);
        }
        log.info("Policy validation passed for {} file(s)", files.size());

        boolean committed;
        try {
            committed = versionControl.commit(commitMessage(wave));
        } catch (VersionControlException e) {
            record("io_failed");
            throw new CheckpointException(waveId, CheckpointException.STEP_COMMIT, wave.taskIds(),
                    "Checkpoint commit for wave " + waveId + " failed: " + e.getMessage(), e);
        }
        record("committed");
        log.info("Checkpoint {} complete", waveId);
        return committed;
    }

    /**
     * @throws VerificationException naming every task not marked complete
     */
    public void verify(Wave wave) {
        Set<String> completed = markers.completedTaskIds(wave.tasks());
        var missing = new ArrayList<String>();
        for (String id : wave.taskIds()) {
            if (!completed.contains(id)) {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            record("verification_failed");
            throw new VerificationException(wave.id(), missing,
                    "Wave %d tasks not marked complete: %s".formatted(wave.id(), String.join(", ", missing)));
        }
        log.info("All {} task(s) of wave {} verified complete", wave.size(), wave.id());
    }

    static String commitMessage(Wave wave) {
        return "[CHECKPOINT] Wave " + wave.id() + " Complete\n\n"
                + "All tasks verified and validated\n\n"
                + "Tasks: " + String.join(", ", wave.taskIds());
    }

    private List<String> changedFiles(Wave wave) {
        List<String> files;
        try {
            files = versionControl.changedFiles();
        } catch (VersionControlException e) {
            record("io_failed");
            throw new CheckpointException(wave.id(), CheckpointException.STEP_POLICY, wave.taskIds(),
                    "Could not list changed files: " + e.getMessage(), e);
        }
        if (!files.isEmpty()) {
            return files;
        }
        var locks = new ArrayList<String>();
        wave.tasks().forEach(t -> t.fileLocks().stream().filter(f -> !locks.contains(f)).forEach(locks::add));
        log.debug("No changed files reported, validating the wave's {} file lock(s)", locks.size());
        return locks;
    }

    private void record(String outcome) {
        if (metrics != null) {
            metrics.recordCheckpoint(outcome);
        }
    }
}
