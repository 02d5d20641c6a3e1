package com.waveforge.collab;

import java.util.List;

/**
 * Checks changed files against project rules before a checkpoint commit.
 */
public interface PolicyValidator {

    /**
     * @param files paths relative to the working tree
     * @return violations; empty when the files pass
     */
    List<PolicyViolation> validate(List<String> files);
}
