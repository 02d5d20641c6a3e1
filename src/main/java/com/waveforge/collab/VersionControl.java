package com.waveforge.collab;

import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The version-control side of a checkpoint.
 */
public interface VersionControl {

    /**
     * @return working-tree paths changed since the last commit, including untracked files
     */
    List<String> changedFiles();

    /**
     * Stages everything and commits.
     *
     * @return false when there was nothing to commit
     * @throws VersionControlException if staging or committing fails
     */
    boolean commit(String message);

    /**
     * A version control that reports no changes and never commits.
     */
    static VersionControl disabled() {
        return new VersionControl() {
            @Override
            public List<String> changedFiles() {
                return List.of();
            }

            @Override
            public boolean commit(String message) {
                LoggerFactory.getLogger(VersionControl.class)
                        .info("Version control disabled, skipping commit: {}", message.lines().findFirst().orElse(""));
                return false;
            }
        };
    }
}
